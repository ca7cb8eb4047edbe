package com.kbengine.embedding;

public record ProviderDescription(String name, String device, boolean available) {
}
