package com.codefarm.shortlink.service.web.dto;

public record ShortenRequest(String url) {
}
