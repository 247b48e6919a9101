package com.stratus.example;

import com.stratus.example.functions.CreateOrder;
import com.stratus.example.functions.GetOrder;
import com.stratus.example.functions.ListOrders;
import com.stratus.example.models.Order;
import com.stratus.example.services.OrderApiModule;
import com.stratus.hosting.CloudApplication;
import com.stratus.hosting.CloudApplicationBuilder;
import lombok.extern.slf4j.Slf4j;

/**
 * Order API. Runs as a local server by default; {@code list}, {@code synth},
 * {@code diff}, {@code deploy} and {@code destroy} switch to the matching
 * command.
 */
@Slf4j
public class OrderApi {

    public static void main(String[] args) {
        try {
            configure(CloudApplication.createBuilder(args)).build().run();
        } catch (Exception e) {
            log.error("Order API failed", e);
            System.exit(1);
        }
    }

    static CloudApplicationBuilder configure(CloudApplicationBuilder builder) {
        return builder
                .addFunctions(CreateOrder.class, GetOrder.class, ListOrders.class)
                .addTables(Order.class)
                .services(new OrderApiModule())
                .configureDefaults(defaults -> {
                    defaults.setStackName("stratus-order-api");
                    defaults.getLambda().setMemoryMb(512);
                    defaults.getLambda().setHandler(OrderApiHandler.class.getName() + "::handleRequest");
                });
    }
}
