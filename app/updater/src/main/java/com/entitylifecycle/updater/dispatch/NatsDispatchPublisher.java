/*
 * どこで: Updater のディスパッチ
 * 何を: ディスパッチ項目を JSON として JetStream のタスク subject へ publish する
 * なぜ: ワーカーは JetStream からタスクを受け取るため、puback を受けたものだけを publish 済みとする
 */
package com.entitylifecycle.updater.dispatch;

import com.entitylifecycle.common.CycleIds;
import com.entitylifecycle.updater.config.UpdaterNatsProperties;
import com.entitylifecycle.updater.model.DispatchItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class NatsDispatchPublisher implements DispatchPublisher {

  static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  static final String HEADER_ENTITY_TYPE = "entity_type";
  static final String HEADER_CYCLE_ID = "cycle_id";

  private final JetStream jetStream;
  private final UpdaterNatsProperties properties;
  private final ObjectMapper objectMapper;

  @Override
  public void publish(DispatchItem item) {
    final byte[] payload;
    try {
      payload = objectMapper.writeValueAsBytes(item);
    } catch (JsonProcessingException ex) {
      throw new DispatchPublishException(
          "failed to serialize dispatch item entityKey=" + item.entityKey(), ex);
    }
    final PublishAck ack;
    try {
      ack = jetStream.publish(properties.subject(), buildHeaders(item), payload);
    } catch (IOException | JetStreamApiException ex) {
      throw new DispatchPublishException(
          "failed to publish dispatch item entityKey=" + item.entityKey(), ex);
    }
    if (ack == null) {
      throw new DispatchPublishException("puback is missing entityKey=" + item.entityKey());
    }
  }

  private Headers buildHeaders(DispatchItem item) {
    final Headers headers = new Headers();
    // 重複窓の内側では、同じ判断の再 publish を JetStream が破棄する。
    headers.add(HEADER_MESSAGE_ID, messageId(item));
    headers.add(HEADER_ENTITY_TYPE, item.entityType());
    final String cycleId = MDC.get(CycleIds.MDC_KEY);
    if (cycleId != null && !cycleId.isBlank()) {
      headers.add(HEADER_CYCLE_ID, cycleId);
    }
    return headers;
  }

  @VisibleForTesting
  static String messageId(DispatchItem item) {
    final String suffix =
        item.delete()
            ? "delete"
            : item.attributeValue(DispatchItem.ATTR_LAST_REGULAR_UPDATE)
                .map(Object::toString)
                .orElse("update");
    return item.entityType() + ":" + item.entityKey() + ":" + suffix;
  }
}
