package com.stratus.deploy;

import com.stratus.api.HttpMethod;
import com.stratus.hosting.CloudApplicationContext;
import com.stratus.hosting.FunctionRegistration;
import com.stratus.hosting.TableRegistration;
import com.stratus.runtime.lambda.LambdaDispatcher;
import com.stratus.table.EntityKeyReflector;
import com.stratus.table.EntityKeys;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Everything a deploy creates, resolved from the application context and
 * independent of CDK.
 */
@Value
@Builder
public class DeploymentPlan {
    String stackName;
    // Lambda runtime identifier, e.g. "java17"
    String lambdaRuntime;
    // DynamoDB billing mode name, e.g. "PAY_PER_REQUEST"
    String billingMode;
    @Singular
    List<FunctionDeployment> functions;
    @Singular
    List<TableDeployment> tables;

    @Value
    public static class FunctionDeployment {
        String name;
        String lambdaName;
        HttpMethod method;
        String route;
        int memoryMb;
        int timeoutSeconds;
        Map<String, String> environment;
    }

    @Value
    public static class TableDeployment {
        String entityName;
        String tableName;
        String environmentVariable;
        String partitionKeyAttribute;
        // null without a sort key
        String sortKeyAttribute;
    }

    public static DeploymentPlan from(CloudApplicationContext context) {
        return from(context, new EntityKeyReflector());
    }

    public static DeploymentPlan from(CloudApplicationContext context, EntityKeyReflector reflector) {
        String stackName = sanitizeStackName(context.getDefaults().getStackName());

        List<TableDeployment> tables = context.getTables().stream()
                .map(table -> toTableDeployment(table, reflector))
                .collect(Collectors.toList());

        DeploymentPlanBuilder plan = DeploymentPlan.builder()
                .stackName(stackName)
                .lambdaRuntime(context.getDefaults().getLambda().getRuntime())
                .billingMode(context.getDefaults().getDynamoDb().getBillingMode())
                .tables(tables);
        for (FunctionRegistration function : context.getFunctions()) {
            Map<String, String> environment = new LinkedHashMap<>();
            environment.put(LambdaDispatcher.FUNCTION_VARIABLE, function.getName());
            for (TableDeployment table : tables) {
                environment.put(table.getEnvironmentVariable(), table.getTableName());
            }
            plan.function(new FunctionDeployment(
                    function.getName(),
                    stackName + "-" + function.getName(),
                    function.getMethod(),
                    function.getRoute(),
                    function.getMemoryMb(),
                    function.getTimeoutSeconds(),
                    Map.copyOf(environment)));
        }
        return plan.build();
    }

    private static TableDeployment toTableDeployment(TableRegistration table, EntityKeyReflector reflector) {
        EntityKeys keys = reflector.getEntityKeys(table.getEntityType());
        return new TableDeployment(
                table.getEntityName(),
                table.physicalName(),
                table.environmentVariable(),
                keys.getPartitionKey().getAttributeName(),
                keys.getSortKey().map(EntityKeys.KeyField::getAttributeName).orElse(null));
    }

    static String sanitizeStackName(String name) {
        String sanitized = name.replace('.', '-').replace('_', '-').replaceAll("[^A-Za-z0-9-]", "");
        if (sanitized.isEmpty() || !Character.isLetter(sanitized.charAt(0))) {
            sanitized = "stratus-" + sanitized;
        }
        return sanitized;
    }
}
