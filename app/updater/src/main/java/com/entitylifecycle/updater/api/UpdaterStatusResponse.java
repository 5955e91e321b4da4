/*
 * どこで: Updater API
 * 何を: 運用者向けのサイクルループのスナップショット
 * なぜ: サイクルが完了し続けているか、ウォーターマークがどれだけ遅れているかを示すため
 */
package com.entitylifecycle.updater.api;

import com.entitylifecycle.updater.model.CycleReport;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UpdaterStatusResponse(Instant watermark, CycleReport lastCycle) {}
