package com.questrail.muxbridge.bus;

import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
public interface PropertySetter
{
    void set(JsonNode value) throws BusError;
}
