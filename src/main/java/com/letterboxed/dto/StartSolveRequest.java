package com.letterboxed.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record StartSolveRequest(
    @NotBlank @Pattern(regexp = "\\p{L}+") String letters,
    @Min(1) Integer minWordLength,
    String strategy) {}
