package com.opensciencecatalog.backend.submission;

/** One child of a directory on the hosting platform, named by its last path segment. */
public record DirectoryEntry(String name, String sha) {}
