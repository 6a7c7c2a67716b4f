package com.opensciencecatalog.backend.item.api;

import java.util.List;

public record ItemsResponse(List<String> items) {}
