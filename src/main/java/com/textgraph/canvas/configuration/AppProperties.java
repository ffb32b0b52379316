package com.textgraph.canvas.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Root of the {@code app.*} namespace in application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ParserProperties parser = new ParserProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SemanticProperties semantic = new SemanticProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private LayoutProperties layout = new LayoutProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private RenderProperties render = new RenderProperties();
}
