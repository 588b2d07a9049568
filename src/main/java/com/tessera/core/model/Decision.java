package com.tessera.core.model;

/**
 * A user's verdict on one proposed change.
 */
public sealed interface Decision permits Decision.Accept, Decision.Reject, Decision.Edit {

    Accept ACCEPT = new Accept();
    Reject REJECT = new Reject();

    record Accept() implements Decision {}

    record Reject() implements Decision {}

    /** Replace the proposed content with {@code newContent} and mark the change MODIFIED. */
    record Edit(String newContent) implements Decision {
        public Edit {
            if (newContent == null) {
                throw new IllegalArgumentException("newContent must not be null");
            }
        }
    }
}
