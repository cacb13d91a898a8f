package me.golemcore.reasoning.domain.model;

public enum ActionKind {
    TOOL_CALL, FINAL_ANSWER
}
