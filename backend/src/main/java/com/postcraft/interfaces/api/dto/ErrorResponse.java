package com.postcraft.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
