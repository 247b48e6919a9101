package com.stratus.table;

import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.client.builder.AwsClientBuilder;
import com.amazonaws.services.dynamodbv2.AmazonDynamoDB;
import com.amazonaws.services.dynamodbv2.AmazonDynamoDBClientBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Key;
import com.google.inject.Provider;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.util.Types;
import com.stratus.api.EntityTable;
import com.stratus.api.TableEntity;
import com.stratus.binding.JsonMappers;
import com.stratus.hosting.TableRegistration;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Binds {@code EntityTable<T>} to DynamoDB-backed tables, for use inside
 * Lambda. The physical name comes from {@code TABLE_<ENTITY>} when set,
 * otherwise from the registration. {@code DYNAMODB_ENDPOINT} points the client
 * at a local DynamoDB.
 */
@Slf4j
public class DynamoDbTableModule extends AbstractModule {
    public static final String ENDPOINT_VARIABLE = "DYNAMODB_ENDPOINT";

    private final List<TableRegistration> tables;
    private final Map<String, String> environment;
    private final EntityKeyReflector reflector = new EntityKeyReflector();
    private final ObjectMapper objectMapper = JsonMappers.create();

    public DynamoDbTableModule(List<TableRegistration> tables, Map<String, String> environment) {
        this.tables = tables;
        this.environment = environment;
    }

    @Override
    protected void configure() {
        bind(EntityKeyReflector.class).toInstance(reflector);
        Provider<AmazonDynamoDB> client = getProvider(AmazonDynamoDB.class);
        for (TableRegistration table : tables) {
            bindTable(table, table.getEntityType().asSubclass(TableEntity.class), client);
        }
    }

    @SuppressWarnings("unchecked")
    private <T extends TableEntity> void bindTable(TableRegistration table, Class<T> entityType,
                                                   Provider<AmazonDynamoDB> client) {
        String tableName = resolveTableName(table, environment);
        EntityKeys keys = reflector.getEntityKeys(entityType);
        Key<EntityTable<T>> key = (Key<EntityTable<T>>) Key.get(Types.newParameterizedType(EntityTable.class, entityType));
        Provider<EntityTable<T>> provider = () -> new DynamoDbTable<>(client.get(), tableName, entityType, keys, objectMapper);
        bind(key).toProvider(provider).in(Singleton.class);
        log.debug("Bound DynamoDB table {} for {}", tableName, table.getEntityName());
    }

    static String resolveTableName(TableRegistration table, Map<String, String> environment) {
        String fromEnvironment = environment.get(table.environmentVariable());
        if (fromEnvironment != null && !fromEnvironment.isEmpty()) {
            return fromEnvironment;
        }
        return table.physicalName();
    }

    @Provides
    @Singleton
    AmazonDynamoDB provideDynamoDB() {
        String endpoint = environment.get(ENDPOINT_VARIABLE);
        if (endpoint != null && !endpoint.isEmpty()) {
            String region = environment.getOrDefault("AWS_REGION", "us-east-1");
            log.info("Using DynamoDB endpoint {}", endpoint);
            return AmazonDynamoDBClientBuilder.standard()
                    .withEndpointConfiguration(new AwsClientBuilder.EndpointConfiguration(endpoint, region))
                    .withCredentials(new AWSStaticCredentialsProvider(new BasicAWSCredentials("dummy", "dummy")))
                    .build();
        }
        return AmazonDynamoDBClientBuilder.defaultClient();
    }
}
