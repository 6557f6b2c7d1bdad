package io.datawrangle.core.connector;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.SdkClientException;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.S3Object;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.engine.Schemas;
import io.datawrangle.core.error.ConnectorIOError;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.WriteAcknowledgement;
import io.datawrangle.core.spi.Connector;
import io.datawrangle.core.spi.ConnectorHandle;
import io.datawrangle.core.spi.Credentials;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Objects in S3 or an S3-compatible store.
 *
 * <p>Settings: {@code bucket}, {@code key} (required), {@code format} (defaults from the key's
 * extension), {@code region}, {@code endpoint}. Credentials keys {@code access_key_id} and
 * {@code secret_access_key}; without them the default AWS provider chain is used.
 */
public final class ObjectStoreConnector implements Connector {

    public static final String ID = "s3";

    private final BiFunction<ObjectNode, Credentials, AmazonS3> clientFactory;

    public ObjectStoreConnector() {
        this(ObjectStoreConnector::buildClient);
    }

    /** Creates a connector with a custom client factory, e.g. one returning a test double. */
    public ObjectStoreConnector(BiFunction<ObjectNode, Credentials, AmazonS3> clientFactory) {
        this.clientFactory = clientFactory;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ObjectNode settingsSchema() {
        return Schemas.object()
                .property("bucket", Schemas.string())
                .property("key", Schemas.string())
                .property("format", Schemas.enumOf("csv", "tsv", "json", "jsonl"))
                .property("region", Schemas.string())
                .property("endpoint", Schemas.string())
                .build();
    }

    @Override
    public List<String> requiredSettings() {
        return List.of("bucket", "key");
    }

    @Override
    public ConnectorHandle open(ObjectNode settings, Credentials credentials) {
        String bucket = settings.path("bucket").asText();
        String key = settings.path("key").asText();
        DatasetFormat format = settings.hasNonNull("format")
                ? DatasetFormat.fromKey(settings.get("format").asText())
                : DatasetFormat.fromFileName(key);
        return new ObjectHandle(clientFactory.apply(settings, credentials), bucket, key, format);
    }

    @Override
    public Dataset read(ConnectorHandle handle) {
        ObjectHandle object = (ObjectHandle) handle;
        try (S3Object s3Object = object.client().getObject(object.bucket(), object.key());
                Reader reader = new InputStreamReader(s3Object.getObjectContent(), StandardCharsets.UTF_8)) {
            return DatasetCodec.read(reader, object.format());
        } catch (AmazonServiceException e) {
            throw new ConnectorIOError(
                    "Failed to get " + object.location() + ": " + e.getErrorMessage(), e, object.location());
        } catch (SdkClientException | IOException e) {
            throw new ConnectorIOError(
                    "Failed to read " + object.location() + ": " + e.getMessage(), e, object.location());
        }
    }

    @Override
    public WriteAcknowledgement write(ConnectorHandle handle, Dataset dataset) {
        ObjectHandle object = (ObjectHandle) handle;
        try {
            StringWriter content = new StringWriter();
            DatasetCodec.write(dataset, content, object.format());
            object.client().putObject(object.bucket(), object.key(), content.toString());
        } catch (SdkClientException | IOException e) {
            throw new ConnectorIOError(
                    "Failed to put " + object.location() + ": " + e.getMessage(), e, object.location());
        }
        return new WriteAcknowledgement(ID, object.location(), dataset.rowCount());
    }

    @Override
    public void close(ConnectorHandle handle) {
        ((ObjectHandle) handle).client().shutdown();
    }

    private static AmazonS3 buildClient(ObjectNode settings, Credentials credentials) {
        AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard();
        String accessKeyId = credentials.get("access_key_id").orElse(null);
        String secretAccessKey = credentials.get("secret_access_key").orElse(null);
        if (accessKeyId != null && secretAccessKey != null) {
            builder.withCredentials(
                    new AWSStaticCredentialsProvider(new BasicAWSCredentials(accessKeyId, secretAccessKey)));
        } else {
            builder.withCredentials(new DefaultAWSCredentialsProviderChain());
        }
        String region = settings.hasNonNull("region") ? settings.get("region").asText() : "us-east-1";
        if (settings.hasNonNull("endpoint")) {
            builder.withEndpointConfiguration(new EndpointConfiguration(settings.get("endpoint").asText(), region))
                    .withPathStyleAccessEnabled(true);
        } else {
            builder.withRegion(region);
        }
        return builder.build();
    }

    private record ObjectHandle(AmazonS3 client, String bucket, String key, DatasetFormat format)
            implements ConnectorHandle {

        @Override
        public String location() {
            return "s3://" + bucket + "/" + key;
        }
    }
}
