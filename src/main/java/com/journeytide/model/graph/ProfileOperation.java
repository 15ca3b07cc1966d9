package com.journeytide.model.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ProfileOperation {
    @JsonProperty("set") SET,
    @JsonProperty("increment") INCREMENT,
    @JsonProperty("append") APPEND
}
