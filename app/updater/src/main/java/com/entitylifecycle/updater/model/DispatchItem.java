/*
 * どこで: Updater のディスパッチモデル
 * 何を: エンティティ 1 件分としてキューへ publish する作業項目
 * なぜ: ワーカーがこの形を受け取り、publish 後は変更しないため
 */
package com.entitylifecycle.updater.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Optional;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DispatchItem(
    String entityType,
    String entityKey,
    List<String> events,
    List<AttributeUpdate> attributeUpdates,
    boolean delete,
    String source) {

  public static final String SOURCE_UPDATER = "updater";
  public static final String ATTR_LAST_REGULAR_UPDATE = "last_regular_update";
  public static final String ATTR_LEASES = "leases";

  public DispatchItem {
    events = events == null ? List.of() : List.copyOf(events);
    attributeUpdates = attributeUpdates == null ? List.of() : List.copyOf(attributeUpdates);
  }

  public static DispatchItem delete(String entityType, String entityKey) {
    return new DispatchItem(entityType, entityKey, List.of(), List.of(), true, SOURCE_UPDATER);
  }

  public static DispatchItem update(
      String entityType,
      String entityKey,
      List<String> events,
      List<AttributeUpdate> attributeUpdates) {
    return new DispatchItem(
        entityType, entityKey, events, attributeUpdates, false, SOURCE_UPDATER);
  }

  public Optional<Object> attributeValue(String attribute) {
    return attributeUpdates.stream()
        .filter(update -> update.attribute().equals(attribute))
        .map(AttributeUpdate::value)
        .reduce((first, second) -> second);
  }
}
