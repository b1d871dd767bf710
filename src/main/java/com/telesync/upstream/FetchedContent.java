package com.telesync.upstream;

public record FetchedContent(byte[] bytes, String contentType) {}
