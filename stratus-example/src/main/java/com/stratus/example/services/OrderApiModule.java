package com.stratus.example.services;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;

public class OrderApiModule extends AbstractModule {
    @Override
    protected void configure() {
        bind(OrderIdGenerator.class).to(UuidOrderIdGenerator.class).in(Singleton.class);
    }
}
