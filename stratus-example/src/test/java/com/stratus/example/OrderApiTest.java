package com.stratus.example;

import com.stratus.example.functions.CreateOrder;
import com.stratus.example.models.Order;
import com.stratus.hosting.CloudApplication;
import com.stratus.hosting.DependencyValidationException;
import com.stratus.runtime.local.LocalRuntime;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(VertxExtension.class)
public class OrderApiTest {
    private WebClient client;

    @BeforeEach
    void setup(Vertx vertx, VertxTestContext testContext) {
        CloudApplication app = OrderApi.configure(CloudApplication.createBuilder(new String[0], Map.of())).build();

        new LocalRuntime().start(vertx, app.getContext(), app.getModules(), 0)
                .onComplete(testContext.succeeding(server -> {
                    client = WebClient.create(vertx, new WebClientOptions()
                            .setDefaultHost("localhost")
                            .setDefaultPort(server.actualPort()));
                    testContext.completeNow();
                }));
    }

    @Test
    void testCreateOrder_thenGetById(VertxTestContext testContext) {
        client.post("/orders")
                .sendJsonObject(new JsonObject().put("customerName", "Alice").put("total", 42.5))
                .compose(created -> {
                    String id = created.bodyAsJsonObject().getString("id");
                    testContext.verify(() -> {
                        assertThat(created.statusCode()).isEqualTo(200);
                        assertThat(id).isNotBlank();
                    });
                    return client.get("/orders/" + id).send()
                            .map(fetched -> {
                                testContext.verify(() -> assertThat(fetched.bodyAsJsonObject().getString("id")).isEqualTo(id));
                                return fetched;
                            });
                })
                .onComplete(testContext.succeeding(fetched -> testContext.verify(() -> {
                    JsonObject order = fetched.bodyAsJsonObject();
                    assertThat(fetched.statusCode()).isEqualTo(200);
                    assertThat(order.getString("customerName")).isEqualTo("Alice");
                    assertThat(order.getDouble("total")).isEqualTo(42.5);
                    testContext.completeNow();
                })));
    }

    @Test
    void testGetOrder_unknownIdIs404(VertxTestContext testContext) {
        client.get("/orders/nope").send()
                .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                    assertThat(response.statusCode()).isEqualTo(404);
                    assertThat(response.bodyAsJsonObject().getString("error")).isEqualTo("Order nope not found");
                    testContext.completeNow();
                })));
    }

    @Test
    void testListOrders_filtersByCustomer(VertxTestContext testContext) {
        client.post("/orders").sendJsonObject(new JsonObject().put("customerName", "Alice").put("total", 10))
                .compose(r -> client.post("/orders").sendJsonObject(new JsonObject().put("customerName", "Bob").put("total", 20)))
                .compose(r -> client.get("/orders").addQueryParam("customerName", "Bob").send())
                .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                    JsonArray orders = response.bodyAsJsonObject().getJsonArray("orders");
                    assertThat(response.statusCode()).isEqualTo(200);
                    assertThat(orders.size()).isEqualTo(1);
                    assertThat(orders.getJsonObject(0).getString("customerName")).isEqualTo("Bob");
                    testContext.completeNow();
                })));
    }

    @Test
    void testListOrders_emptyTable(VertxTestContext testContext) {
        client.get("/orders").send()
                .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                    assertThat(response.statusCode()).isEqualTo(200);
                    assertThat(response.bodyAsJsonObject().getJsonArray("orders")).isEmpty();
                    testContext.completeNow();
                })));
    }

    @Test
    void testBuild_withoutServicesFailsValidation() {
        assertThatThrownBy(() -> CloudApplication.createBuilder(new String[0], Map.of())
                .addFunctions(CreateOrder.class)
                .build())
                .isInstanceOf(DependencyValidationException.class)
                .hasMessageContaining("CreateOrder requires OrderIdGenerator (parameter 'ids')");
    }

    @Test
    void testList_describesResourcesWithoutValidation() {
        CloudApplication app = CloudApplication.createBuilder(new String[]{"list"}, Map.of())
                .addFunctions(CreateOrder.class)
                .addTables(Order.class)
                .build();

        assertThat(app.describeResources()).contains("POST").contains("/orders").contains("Orders");
    }
}
