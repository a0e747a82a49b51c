package app.lingvo.core.study.controller.dto;

public record HintTextRequest(String text) {}
