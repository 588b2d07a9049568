package com.tessera.core.workspace;

import java.time.Instant;

public record FileInfo(String path, long size, int lineCount, String language, Instant lastModified) {}
