package com.scholary.mp3.fetcher.api;

/** JSON body of every error response: {@code {"error": "..."}}. */
public record ErrorResponse(String error) {}
