package com.delta.listener.signal.model;

import java.util.List;

public record ScanRunPage(List<ScanRun> runs, long total, int limit, int offset) {}
