package com.cario.contimg.app.scheduler;

import com.cario.contimg.app.service.PublishService;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;

/** Drains publishable products and repairs rows stuck in publishing. */
@Log4j2
@RequiredArgsConstructor
public class PublishScheduler {

  private final PublishService publish;

  @Scheduled(fixedDelayString = "${pipeline.publish.drain-interval-ms:60000}")
  public void drain() {
    log.debug("publish.tick");
    publish.drainReady();
  }

  @Scheduled(fixedDelayString = "${pipeline.publish.reconcile-interval-ms:300000}")
  public void reconcile() {
    publish.reconcileStale();
  }
}
