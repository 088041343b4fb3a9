package com.mibprofile.api.dto;

/**
 * GET /api/v1/templates/select response: the reference template chosen for a target (possibly the fallback).
 */
public record SelectionResponse(String target, String path) {
}
