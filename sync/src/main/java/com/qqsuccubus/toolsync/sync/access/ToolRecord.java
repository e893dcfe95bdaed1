package com.qqsuccubus.toolsync.sync.access;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ToolRecord {
    String id;
    String name;
    String authorId;
}
