package com.asiainfo.deepdive.api.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

@RegisterForReflection
public record PerspectiveChangeRequest(String perspective) {
}
