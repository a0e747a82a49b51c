package app.lingvo.core.study.controller.dto;

public record AnswerRequest(Integer score) {}
