package com.numaansystems.oauth.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.Paths;
import io.swagger.v3.oas.models.headers.Header;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.responses.ApiResponses;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;

/**
 * Swagger/OpenAPI configuration for API documentation.
 *
 * <p>The login routes are served by a servlet filter rather than a controller,
 * so springdoc cannot discover them. They are described here by hand.</p>
 *
 * <h2>Access</h2>
 * <ul>
 *   <li>Swagger UI: /swagger-ui.html</li>
 *   <li>OpenAPI JSON: /api-docs</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
public class SwaggerConfig {

    static final String INITIATE_PATH = "/auth/{providerType}";
    static final String CALLBACK_PATH = "/auth/{providerType}/callback";

    /**
     * Configures OpenAPI documentation metadata and the provider login routes.
     *
     * @return OpenAPI configuration with title, description, version, contact info and login paths
     */
    @Bean
    public OpenAPI oauthMiddlewareOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("OAuth Middleware API")
                .description("Third-party (OAuth2) login for servlet applications")
                .version("0.1.0")
                .contact(new Contact()
                    .name("Numaan Systems")
                    .email("support@numaansystems.com"))
                .license(new License()
                    .name("MIT License")
                    .url("https://opensource.org/licenses/MIT")))
            .paths(new Paths()
                .addPathItem(INITIATE_PATH, new PathItem().get(initiateOperation()))
                .addPathItem(CALLBACK_PATH, new PathItem().get(callbackOperation())));
    }

    private Operation initiateOperation() {
        return new Operation()
            .operationId("initiateLogin")
            .summary("Start a provider login")
            .description("Stores the return URL and redirects to the provider's authorization page.")
            .addTagsItem("oauth")
            .addParametersItem(providerTypeParameter())
            .addParametersItem(new Parameter()
                .in("query")
                .name("return")
                .required(true)
                .description("Absolute URL the client is sent back to after login")
                .schema(new StringSchema()))
            .responses(new ApiResponses()
                .addApiResponse("302", new ApiResponse()
                    .description("Redirect to the provider's authorization endpoint")
                    .addHeaderObject(HttpHeaders.LOCATION, new Header().schema(new StringSchema()))));
    }

    private Operation callbackOperation() {
        return new Operation()
            .operationId("completeLogin")
            .summary("Provider callback")
            .description("Exchanges the authorization code, creates the user and returns its token.")
            .addTagsItem("oauth")
            .addParametersItem(providerTypeParameter())
            .addParametersItem(new Parameter()
                .in("query")
                .name("code")
                .description("Authorization code issued by the provider")
                .schema(new StringSchema()))
            .addParametersItem(new Parameter()
                .in("query")
                .name("error")
                .description("Error reported by the provider instead of a code")
                .schema(new StringSchema()))
            .responses(new ApiResponses()
                .addApiResponse("200", new ApiResponse()
                    .description("Login completed; Location holds the stored return URL")
                    .addHeaderObject(HttpHeaders.AUTHORIZATION, new Header()
                        .description("token <value>")
                        .schema(new StringSchema()))
                    .addHeaderObject(HttpHeaders.LOCATION, new Header().schema(new StringSchema()))));
    }

    private static Parameter providerTypeParameter() {
        return new Parameter()
            .in("path")
            .name("providerType")
            .required(true)
            .description("Configured provider type, e.g. github")
            .schema(new StringSchema());
    }
}
