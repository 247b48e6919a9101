package com.stratus.example.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.stratus.api.PartitionKey;
import com.stratus.api.TableEntity;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class Order implements TableEntity {
    @PartitionKey
    @JsonProperty("id")
    private String id;

    @JsonProperty("customerName")
    private String customerName;

    @JsonProperty("total")
    private BigDecimal total;
}
