package com.flamingo.ai.researchcache.source;

/** A collection node as returned by the remote library. */
public record RemoteCollection(String key, String name, String parentKey, long version) {}
