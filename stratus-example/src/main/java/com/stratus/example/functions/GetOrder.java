package com.stratus.example.functions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.stratus.api.EntityTable;
import com.stratus.api.HttpApi;
import com.stratus.api.HttpFunction;
import com.stratus.api.HttpMethod;
import com.stratus.api.NotFoundException;
import com.stratus.example.models.Order;
import io.vertx.core.Future;
import lombok.Getter;

import javax.inject.Inject;

@HttpApi(method = HttpMethod.GET, route = "/orders/{id}")
public class GetOrder implements HttpFunction<GetOrder.Request, Order> {
    private final EntityTable<Order> orders;

    @Inject
    public GetOrder(EntityTable<Order> orders) {
        this.orders = orders;
    }

    @Override
    public Future<Order> handle(Request request) {
        return orders.get(request.getId()).compose(order -> {
            if (order.isEmpty()) {
                return Future.failedFuture(new NotFoundException("Order " + request.getId() + " not found"));
            }
            return Future.succeededFuture(order.get());
        });
    }

    @Getter
    public static class Request {
        private final String id;

        @JsonCreator
        public Request(@JsonProperty("id") String id) {
            this.id = id;
        }
    }
}
