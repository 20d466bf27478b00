package com.myorg.evreg.delivery.fallback;

import java.nio.file.Path;

public record StoredFallback(Path file, FallbackEntry entry) {
}
