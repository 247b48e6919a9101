package com.stratus.deploy;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awscdk.App;
import software.amazon.awscdk.AppProps;
import software.amazon.awscdk.CfnOutput;
import software.amazon.awscdk.Duration;
import software.amazon.awscdk.RemovalPolicy;
import software.amazon.awscdk.Stack;
import software.amazon.awscdk.aws_apigatewayv2_integrations.HttpLambdaIntegration;
import software.amazon.awscdk.services.apigatewayv2.AddRoutesOptions;
import software.amazon.awscdk.services.apigatewayv2.HttpApi;
import software.amazon.awscdk.services.apigatewayv2.HttpMethod;
import software.amazon.awscdk.services.dynamodb.Attribute;
import software.amazon.awscdk.services.dynamodb.AttributeType;
import software.amazon.awscdk.services.dynamodb.BillingMode;
import software.amazon.awscdk.services.dynamodb.Table;
import software.amazon.awscdk.services.lambda.Architecture;
import software.amazon.awscdk.services.lambda.Code;
import software.amazon.awscdk.services.lambda.Function;
import software.amazon.awscdk.services.lambda.Runtime;
import software.amazon.awscdk.services.lambda.RuntimeFamily;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link DeploymentPlan} into a CDK app: a DynamoDB table per entity,
 * a Lambda per function and one HTTP API routing to them.
 */
@Slf4j
public class StackGenerator {
    private final String handler;
    private final String codeAsset;
    private final String outdir;

    /**
     * @param handler   Lambda handler, e.g. {@code com.acme.OrdersHandler::handleRequest}
     * @param codeAsset path of the packaged application jar
     * @param outdir    cloud assembly output directory
     */
    public StackGenerator(String handler, String codeAsset, String outdir) {
        this.handler = handler;
        this.codeAsset = codeAsset;
        this.outdir = outdir;
    }

    public App generate(DeploymentPlan plan) {
        App app = new App(AppProps.builder().outdir(outdir).build());
        Stack stack = new Stack(app, plan.getStackName());

        List<Table> tables = new ArrayList<>();
        for (DeploymentPlan.TableDeployment table : plan.getTables()) {
            tables.add(createTable(stack, table, plan.getBillingMode()));
        }

        HttpApi httpApi = HttpApi.Builder.create(stack, "HttpApi")
                .apiName(plan.getStackName() + "-Api")
                .build();

        for (DeploymentPlan.FunctionDeployment function : plan.getFunctions()) {
            Function lambda = createFunction(stack, function, plan.getLambdaRuntime());
            tables.forEach(table -> table.grantReadWriteData(lambda));

            httpApi.addRoutes(AddRoutesOptions.builder()
                    .path(function.getRoute())
                    .methods(List.of(HttpMethod.valueOf(function.getMethod().name())))
                    .integration(new HttpLambdaIntegration(function.getName() + "Integration", lambda))
                    .build());
            log.debug("Planned {} {} -> {}", function.getMethod(), function.getRoute(), function.getLambdaName());
        }

        CfnOutput.Builder.create(stack, "ApiUrl")
                .value(httpApi.getApiEndpoint())
                .description("HTTP API endpoint URL")
                .build();
        return app;
    }

    private static Table createTable(Stack stack, DeploymentPlan.TableDeployment table, String billingMode) {
        Table.Builder builder = Table.Builder.create(stack, table.getEntityName() + "Table")
                .tableName(table.getTableName())
                .partitionKey(Attribute.builder()
                        .name(table.getPartitionKeyAttribute())
                        .type(AttributeType.STRING)
                        .build())
                .billingMode(BillingMode.valueOf(billingMode))
                .removalPolicy(RemovalPolicy.DESTROY);
        if (table.getSortKeyAttribute() != null) {
            builder.sortKey(Attribute.builder()
                    .name(table.getSortKeyAttribute())
                    .type(AttributeType.STRING)
                    .build());
        }
        return builder.build();
    }

    private Function createFunction(Stack stack, DeploymentPlan.FunctionDeployment function, String runtime) {
        return Function.Builder.create(stack, function.getName())
                .functionName(function.getLambdaName())
                .runtime(new Runtime(runtime, RuntimeFamily.JAVA))
                .handler(handler)
                .code(Code.fromAsset(codeAsset))
                .memorySize(function.getMemoryMb())
                .timeout(Duration.seconds(function.getTimeoutSeconds()))
                .architecture(Architecture.ARM_64)
                .environment(function.getEnvironment())
                .build();
    }
}
