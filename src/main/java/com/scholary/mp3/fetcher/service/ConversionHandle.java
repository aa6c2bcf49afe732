package com.scholary.mp3.fetcher.service;

import com.scholary.mp3.fetcher.progress.ProgressChannel;

/** What the caller gets back from starting a job: its token and its progress stream. */
public record ConversionHandle(String token, ProgressChannel channel) {}
