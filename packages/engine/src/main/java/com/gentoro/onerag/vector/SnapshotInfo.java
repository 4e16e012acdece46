package com.gentoro.onerag.vector;

public record SnapshotInfo(String name, String creationTime, long size) {}
