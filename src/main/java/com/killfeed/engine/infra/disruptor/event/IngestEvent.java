package com.killfeed.engine.infra.disruptor.event;

import com.killfeed.engine.domain.service.scan.ScanResult;

public class IngestEvent {

    private IngestEventType type;
    private String chunk;
    private String origin;
    private long ingestNanoTime;

    private ScanResult scanResult;

    public void clear() {
        type = null;
        chunk = null;
        origin = null;
        ingestNanoTime = 0L;
        scanResult = null;
    }

    public IngestEventType getType() {
        return type;
    }

    public void setType(IngestEventType type) {
        this.type = type;
    }

    public String getChunk() {
        return chunk;
    }

    public void setChunk(String chunk) {
        this.chunk = chunk;
    }

    public String getOrigin() {
        return origin;
    }

    public void setOrigin(String origin) {
        this.origin = origin;
    }

    public long getIngestNanoTime() {
        return ingestNanoTime;
    }

    public void setIngestNanoTime(long ingestNanoTime) {
        this.ingestNanoTime = ingestNanoTime;
    }

    public ScanResult getScanResult() {
        return scanResult;
    }

    public void setScanResult(ScanResult scanResult) {
        this.scanResult = scanResult;
    }

    @Override
    public String toString() {
        return "IngestEvent{type=" + type + ", origin=" + origin
                + ", chars=" + (chunk == null ? 0 : chunk.length()) + "}";
    }
}
