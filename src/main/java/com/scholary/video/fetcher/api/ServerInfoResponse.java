package com.scholary.video.fetcher.api;

/** Where to browse all downloads. */
public record ServerInfoResponse(String browseUrl) {}
