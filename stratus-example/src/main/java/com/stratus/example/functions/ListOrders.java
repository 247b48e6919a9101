package com.stratus.example.functions;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.stratus.api.EntityTable;
import com.stratus.api.HttpApi;
import com.stratus.api.HttpFunction;
import com.stratus.api.HttpMethod;
import com.stratus.example.models.Order;
import io.vertx.core.Future;
import lombok.Data;
import lombok.Getter;

import javax.inject.Inject;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Lists every order, optionally only those of one customer
 * ({@code GET /orders?customerName=Alice}).
 */
@HttpApi(method = HttpMethod.GET, route = "/orders")
public class ListOrders implements HttpFunction<ListOrders.Request, ListOrders.Response> {
    private final EntityTable<Order> orders;

    @Inject
    public ListOrders(EntityTable<Order> orders) {
        this.orders = orders;
    }

    @Override
    public Future<Response> handle(Request request) {
        return orders.scan().map(all -> new Response(all.stream()
                .filter(order -> request.getCustomerName() == null
                        || request.getCustomerName().equals(order.getCustomerName()))
                .sorted(Comparator.comparing(Order::getId))
                .collect(Collectors.toList())));
    }

    @Data
    public static class Request {
        @JsonProperty("customerName")
        private String customerName;
    }

    @Getter
    public static class Response {
        @JsonProperty("orders")
        private final List<Order> orders;

        public Response(List<Order> orders) {
            this.orders = orders;
        }
    }
}
