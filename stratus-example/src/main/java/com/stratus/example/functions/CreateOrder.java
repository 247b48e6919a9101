package com.stratus.example.functions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.stratus.api.EntityTable;
import com.stratus.api.HttpApi;
import com.stratus.api.HttpFunction;
import com.stratus.api.HttpMethod;
import com.stratus.example.models.Order;
import com.stratus.example.services.OrderIdGenerator;
import io.vertx.core.Future;
import lombok.Getter;
import org.slf4j.Logger;

import javax.inject.Inject;
import java.math.BigDecimal;

@HttpApi(method = HttpMethod.POST, route = "/orders")
public class CreateOrder implements HttpFunction<CreateOrder.Request, CreateOrder.Response> {
    private final EntityTable<Order> orders;
    private final OrderIdGenerator ids;
    private final Logger log;

    @Inject
    public CreateOrder(EntityTable<Order> orders, OrderIdGenerator ids, Logger log) {
        this.orders = orders;
        this.ids = ids;
        this.log = log;
    }

    @Override
    public Future<Response> handle(Request request) {
        Order order = new Order();
        order.setId(ids.nextId());
        order.setCustomerName(request.getCustomerName());
        order.setTotal(request.getTotal());

        return orders.put(order)
                .onSuccess(v -> log.info("Created order {} for {}", order.getId(), order.getCustomerName()))
                .map(v -> new Response(order.getId()));
    }

    @Getter
    public static class Request {
        private final String customerName;
        private final BigDecimal total;

        @JsonCreator
        public Request(@JsonProperty("customerName") String customerName,
                       @JsonProperty("total") BigDecimal total) {
            this.customerName = customerName;
            this.total = total;
        }
    }

    @Getter
    public static class Response {
        @JsonProperty("id")
        private final String id;

        public Response(String id) {
            this.id = id;
        }
    }
}
