package com.journeytide.model.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ExitActionType {
    @JsonProperty("branch") BRANCH,
    @JsonProperty("continue") CONTINUE,
    @JsonProperty("wait") WAIT,
    @JsonProperty("exit") EXIT
}
