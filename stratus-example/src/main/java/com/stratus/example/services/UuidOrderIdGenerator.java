package com.stratus.example.services;

import java.util.UUID;

public class UuidOrderIdGenerator implements OrderIdGenerator {
    @Override
    public String nextId() {
        return UUID.randomUUID().toString();
    }
}
