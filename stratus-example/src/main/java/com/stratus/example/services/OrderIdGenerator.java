package com.stratus.example.services;

public interface OrderIdGenerator {
    String nextId();
}
