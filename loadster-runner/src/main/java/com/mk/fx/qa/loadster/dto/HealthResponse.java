package com.mk.fx.qa.loadster.dto;

public record HealthResponse(String status) {}
