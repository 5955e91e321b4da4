/*
 * どこで: Updater API
 * 何を: サイクルループの状態を読み取り専用で返す
 * なぜ: ログを追わずにウォーターマークと直近サイクルの結果を確認できるようにするため
 */
package com.entitylifecycle.updater.api;

import com.entitylifecycle.updater.worker.CycleDriver;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class UpdaterStatusController {

  private final CycleDriver cycleDriver;

  @GetMapping("/")
  public String home() {
    return "updater: ok";
  }

  @GetMapping("/updater/status")
  public UpdaterStatusResponse status() {
    return new UpdaterStatusResponse(
        cycleDriver.watermark(), cycleDriver.lastReport().orElse(null));
  }
}
