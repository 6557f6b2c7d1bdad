package io.datawrangle.core.engine.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.connector.ConnectorRegistry;
import io.datawrangle.core.connector.ConnectorSession;
import io.datawrangle.core.engine.CommonKeys;
import io.datawrangle.core.engine.Schemas;
import io.datawrangle.core.engine.StepKind;
import io.datawrangle.core.engine.StepRegistry;
import io.datawrangle.core.model.Section;
import io.datawrangle.core.model.StepDescriptor;
import io.datawrangle.core.spi.Connector;
import io.datawrangle.core.spi.SinkStep;
import io.datawrangle.core.spi.SourceStep;
import java.util.Iterator;
import java.util.Map;

/**
 * Exposes every registered connector as a read kind and/or a write kind named after its id. The
 * step configuration minus the section's common keys is handed to {@link Connector#open}; each
 * execution opens its own session and closes it before returning.
 */
final class ConnectorSteps {

    private ConnectorSteps() {}

    static void register(StepRegistry.Builder registry, ConnectorRegistry connectors) {
        for (Connector connector : connectors.all()) {
            if (connector.supportsRead()) {
                registry.register(kind(connector, Section.READ)
                        .description("Reads a dataset through the " + connector.id() + " connector")
                        .factory((d, r) -> source(d, r.connector(connector.id())))
                        .build());
            }
            if (connector.supportsWrite()) {
                registry.register(kind(connector, Section.WRITE)
                        .description("Writes the dataset through the " + connector.id() + " connector")
                        .factory((d, r) -> sink(d, r.connector(connector.id())))
                        .build());
            }
        }
    }

    private static StepKind.Builder kind(Connector connector, Section section) {
        ObjectNode settings = connector.settingsSchema();
        JsonNode properties = settings.get("properties");
        Schemas.ObjectSchema configuration = Schemas.object().required(connector.requiredSettings());
        if (properties instanceof ObjectNode objectProperties) {
            configuration.properties(objectProperties);
        }
        StepKind.Builder builder = StepKind.builder(connector.id(), section).configuration(configuration);
        if (connector.requiredSettings().size() == 1) {
            builder.shorthand(connector.requiredSettings().get(0));
        }
        return builder;
    }

    private static SourceStep source(StepDescriptor descriptor, Connector connector) {
        ObjectNode settings = settings(descriptor);
        String credentials = credentialsName(descriptor);
        return context -> {
            try (ConnectorSession session = ConnectorSession.open(
                    connector,
                    settings,
                    context.credentials(credentials, connector.id()),
                    context.position(),
                    context.kind())) {
                return session.read();
            }
        };
    }

    private static SinkStep sink(StepDescriptor descriptor, Connector connector) {
        ObjectNode settings = settings(descriptor);
        String credentials = credentialsName(descriptor);
        return (dataset, context) -> {
            try (ConnectorSession session = ConnectorSession.open(
                    connector,
                    settings,
                    context.credentials(credentials, connector.id()),
                    context.position(),
                    context.kind())) {
                return session.write(dataset);
            }
        };
    }

    /** The connector's own keys: the configuration without the section's common keys. */
    static ObjectNode settings(StepDescriptor descriptor) {
        ObjectNode settings = descriptor.config().deepCopy();
        Iterator<Map.Entry<String, JsonNode>> fields = settings.fields();
        while (fields.hasNext()) {
            if (CommonKeys.isCommon(descriptor.section(), fields.next().getKey())) {
                fields.remove();
            }
        }
        return settings;
    }

    private static String credentialsName(StepDescriptor descriptor) {
        JsonNode name = descriptor.config().get(CommonKeys.CREDENTIALS);
        return name != null && name.isTextual() ? name.asText() : null;
    }
}
