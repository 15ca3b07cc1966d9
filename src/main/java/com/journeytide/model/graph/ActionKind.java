package com.journeytide.model.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ActionKind {
    @JsonProperty("send_whatsapp") SEND_WHATSAPP,
    @JsonProperty("add_tag") ADD_TAG,
    @JsonProperty("update_property") UPDATE_PROPERTY
}
