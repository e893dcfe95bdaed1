package com.qqsuccubus.toolsync.sync.service;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class AckRequest {
    String updateEventId;
}
