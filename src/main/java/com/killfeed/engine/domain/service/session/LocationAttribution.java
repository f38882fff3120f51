package com.killfeed.engine.domain.service.session;

public record LocationAttribution(String token, boolean fallback) {
}
