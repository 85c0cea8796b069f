package com.delta.listener.signal.model;

import java.util.List;

public record AuthorProfilePage(List<AuthorProfile> authors, long total, int limit, int offset) {}
