/*
 * どこで: Updater のディスパッチ
 * 何を: NATS 無効時にディスパッチ項目を publish せずログ出力する
 * なぜ: キューなしでデータストアに対するスケジュールの試行ができるようにするため
 */
package com.entitylifecycle.updater.dispatch;

import com.entitylifecycle.updater.model.DispatchItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class LoggingDispatchPublisher implements DispatchPublisher {

  private static final Logger logger = LoggerFactory.getLogger(LoggingDispatchPublisher.class);

  @Override
  public void publish(DispatchItem item) {
    logger.info(
        "dry-run dispatch entityType={} entityKey={} delete={} events={} updates={}",
        item.entityType(),
        item.entityKey(),
        item.delete(),
        item.events(),
        item.attributeUpdates());
  }
}
