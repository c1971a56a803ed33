package com.kingtable.game.api;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** ロードバランサ向けの軽量な生存確認。詳細は actuator の health を使う。 */
@RestController
public class StatusController {

  @GetMapping("/healthz")
  public ResponseEntity<String> healthz() {
    return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body("ok");
  }
}
