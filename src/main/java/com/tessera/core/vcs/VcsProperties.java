package com.tessera.core.vcs;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "tessera.vcs")
public class VcsProperties {

    /** Commit applied changes to git after a successful apply. */
    private boolean enabled = false;
    private String authorName = "Tessera";
    private String authorEmail = "tessera@localhost";
    /** Used when the caller supplies no message; %s is the command input. */
    private String messageTemplate = "tessera: %s";

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getAuthorName() { return authorName; }
    public void setAuthorName(String authorName) { this.authorName = authorName; }
    public String getAuthorEmail() { return authorEmail; }
    public void setAuthorEmail(String authorEmail) { this.authorEmail = authorEmail; }
    public String getMessageTemplate() { return messageTemplate; }
    public void setMessageTemplate(String messageTemplate) { this.messageTemplate = messageTemplate; }
}
