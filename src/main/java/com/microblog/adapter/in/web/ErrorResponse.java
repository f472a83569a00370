package com.microblog.adapter.in.web;

public record ErrorResponse(
    String error,
    String message,
    String requestId
) {}
