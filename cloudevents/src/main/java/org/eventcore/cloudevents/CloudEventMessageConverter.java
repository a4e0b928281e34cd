/*
 * Copyright 2026 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventcore.cloudevents;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.cloudevents.CloudEvent;
import io.cloudevents.CloudEventData;
import io.cloudevents.core.builder.CloudEventBuilder;
import io.cloudevents.core.data.PojoCloudEventData;
import io.cloudevents.jackson.JsonFormat;
import org.eventcore.errors.ValidationException;
import org.eventcore.message.Message;
import org.eventcore.message.RecordedMessage;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Modifier;
import java.net.URI;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Converts messages to and from <a href="https://cloudevents.io">CloudEvents</a>. The message is serialized to JSON
 * (content type {@value #CONTENT_TYPE}) with a Jackson {@link ObjectMapper} and the store assigned metadata of a
 * {@link RecordedMessage} is mapped to cloud event attributes:
 * <table>
 *     <tr><th>Cloud event</th><th>Recorded message</th></tr>
 *     <tr><td>id</td><td>messageId</td></tr>
 *     <tr><td>type</td><td>{@link Message#type()}</td></tr>
 *     <tr><td>subject</td><td>streamName</td></tr>
 *     <tr><td>{@value #STREAM_POSITION} extension</td><td>streamPosition</td></tr>
 *     <tr><td>{@value #GLOBAL_POSITION} extension</td><td>globalPosition</td></tr>
 * </table>
 * Converting back requires that the cloud event type is registered, see {@link Builder#type(String, Class)}.
 * <pre>
 * CloudEventMessageConverter converter = CloudEventMessageConverter.builder(URI.create("urn:shopping-carts"))
 *         .type(ProductItemAdded.class)
 *         .type(ShoppingCartConfirmed.class)
 *         .build();
 * </pre>
 */
public class CloudEventMessageConverter {
    public static final String CONTENT_TYPE = "application/json";
    public static final String STREAM_POSITION = "streamposition";
    public static final String GLOBAL_POSITION = "globalposition";

    private final ObjectMapper objectMapper;
    private final URI source;
    private final Map<String, Class<? extends Message>> types;
    private final Clock clock;
    private final JsonFormat jsonFormat = new JsonFormat();

    private CloudEventMessageConverter(ObjectMapper objectMapper, URI source, Map<String, Class<? extends Message>> types, Clock clock) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(source, "source cannot be null");
        requireNonNull(types, "types cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        types.forEach(CloudEventMessageConverter::validateType);
        this.objectMapper = objectMapper;
        this.source = source;
        this.types = Map.copyOf(types);
        this.clock = clock;
    }

    /**
     * @param source The cloud event source, e.g. {@code urn:shopping-carts}
     * @return A builder that uses an {@link ObjectMapper} with the {@link JavaTimeModule} registered and dates written as ISO-8601 strings
     */
    public static Builder builder(URI source) {
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return new Builder(objectMapper, source);
    }

    public static Builder builder(ObjectMapper objectMapper, URI source) {
        return new Builder(objectMapper, source);
    }

    /**
     * Convert a recorded message, the store assigned metadata is included.
     */
    public CloudEvent toCloudEvent(RecordedMessage<? extends Message> recordedMessage) {
        requireNonNull(recordedMessage, RecordedMessage.class.getSimpleName() + " cannot be null");
        CloudEventBuilder builder = newCloudEvent(recordedMessage.message())
                .withId(recordedMessage.messageId())
                .withSubject(recordedMessage.streamName())
                .withExtension(STREAM_POSITION, recordedMessage.streamPosition());
        if (recordedMessage.hasGlobalPosition()) {
            builder.withExtension(GLOBAL_POSITION, recordedMessage.globalPosition());
        }
        return builder.build();
    }

    /**
     * Convert a message that hasn't been stored, a random id is generated.
     */
    public CloudEvent toCloudEvent(Message message) {
        requireNonNull(message, Message.class.getSimpleName() + " cannot be null");
        return newCloudEvent(message)
                .withId(UUID.randomUUID().toString())
                .build();
    }

    public Message toMessage(CloudEvent cloudEvent) {
        requireNonNull(cloudEvent, CloudEvent.class.getSimpleName() + " cannot be null");
        Class<? extends Message> messageType = types.get(cloudEvent.getType());
        if (messageType == null) {
            throw new ValidationException("Cloud event type " + cloudEvent.getType() + " is not registered");
        }
        return deserialize(cloudEvent.getData(), messageType);
    }

    /**
     * Convert a cloud event that was created from a {@link RecordedMessage} back into one.
     *
     * @throws ValidationException If the type isn't registered or if the cloud event lacks the subject or the stream position
     */
    public RecordedMessage<Message> toRecordedMessage(CloudEvent cloudEvent) {
        Message message = toMessage(cloudEvent);
        String streamName = cloudEvent.getSubject();
        if (streamName == null) {
            throw new ValidationException("Cloud event " + cloudEvent.getId() + " has no subject, cannot determine the stream name");
        }
        Long streamPosition = positionOf(cloudEvent, STREAM_POSITION);
        if (streamPosition == null) {
            throw new ValidationException("Cloud event " + cloudEvent.getId() + " has no " + STREAM_POSITION + " extension");
        }
        Long globalPosition = positionOf(cloudEvent, GLOBAL_POSITION);
        return new RecordedMessage<>(message, cloudEvent.getId(), streamName, streamPosition, globalPosition == null ? RecordedMessage.NO_GLOBAL_POSITION : globalPosition);
    }

    /**
     * Serialize a recorded message to a cloud event in the structured JSON format, ready to be sent to a broker.
     */
    public byte[] toJson(RecordedMessage<? extends Message> recordedMessage) {
        return jsonFormat.serialize(toCloudEvent(recordedMessage));
    }

    public RecordedMessage<Message> fromJson(byte[] json) {
        requireNonNull(json, "json cannot be null");
        return toRecordedMessage(jsonFormat.deserialize(json));
    }

    private CloudEventBuilder newCloudEvent(Message message) {
        // @formatter:off
        PojoCloudEventData<Map<String, Object>> data = PojoCloudEventData.wrap(objectMapper.convertValue(message, new TypeReference<Map<String, Object>>() {}), objectMapper::writeValueAsBytes);
        // @formatter:on
        return CloudEventBuilder.v1()
                .withSource(source)
                .withType(message.type())
                .withTime(OffsetDateTime.now(clock))
                .withDataContentType(CONTENT_TYPE)
                .withData(data);
    }

    @SuppressWarnings("unchecked")
    private <M extends Message> M deserialize(@Nullable CloudEventData data, Class<M> messageType) {
        if (data instanceof PojoCloudEventData && ((PojoCloudEventData<Object>) data).getValue() instanceof Map) {
            return objectMapper.convertValue(((PojoCloudEventData<?>) data).getValue(), messageType);
        }
        try {
            return objectMapper.readValue(requireNonNull(data, "cloud event data cannot be null").toBytes(), messageType);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static @Nullable Long positionOf(CloudEvent cloudEvent, String extensionName) {
        Object value = cloudEvent.getExtension(extensionName);
        if (value == null) {
            return null;
        } else if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(value.toString());
    }

    private static void validateType(String type, Class<? extends Message> messageType) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Cloud event type cannot be blank");
        }
        requireNonNull(messageType, "Message class for type " + type + " cannot be null");
        if (messageType.isInterface() || Modifier.isAbstract(messageType.getModifiers())) {
            throw new IllegalArgumentException("Cloud event type " + type + " must be mapped to a concrete class, " + messageType.getName() + " is abstract");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CloudEventMessageConverter)) return false;
        CloudEventMessageConverter that = (CloudEventMessageConverter) o;
        return Objects.equals(objectMapper, that.objectMapper) && Objects.equals(source, that.source) && Objects.equals(types, that.types) && Objects.equals(clock, that.clock);
    }

    @Override
    public int hashCode() {
        return Objects.hash(objectMapper, source, types, clock);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", CloudEventMessageConverter.class.getSimpleName() + "[", "]")
                .add("source=" + source)
                .add("types=" + types.keySet())
                .toString();
    }

    public static final class Builder {
        private final ObjectMapper objectMapper;
        private final URI source;
        private final Map<String, Class<? extends Message>> types = new LinkedHashMap<>();
        private Clock clock = Clock.systemUTC();

        private Builder(ObjectMapper objectMapper, URI source) {
            this.objectMapper = objectMapper;
            this.source = source;
        }

        /**
         * Register a message class under its simple name, which is the default {@link Message#type()}.
         */
        public Builder type(Class<? extends Message> messageType) {
            requireNonNull(messageType, "messageType cannot be null");
            return type(messageType.getSimpleName(), messageType);
        }

        /**
         * @throws IllegalArgumentException If {@code type} is already registered for another class
         */
        public Builder type(String type, Class<? extends Message> messageType) {
            Class<? extends Message> existing = types.putIfAbsent(type, messageType);
            if (existing != null && !existing.equals(messageType)) {
                throw new IllegalArgumentException("Cloud event type " + type + " is already registered for " + existing.getName());
            }
            return this;
        }

        /**
         * @param clock The clock used for the cloud event time, defaults to the system UTC clock
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CloudEventMessageConverter build() {
            return new CloudEventMessageConverter(objectMapper, source, types, clock);
        }
    }
}
