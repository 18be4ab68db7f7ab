package com.cario.contimg.app.scheduler;

import com.cario.contimg.app.service.GroupFormationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;

@Log4j2
@RequiredArgsConstructor
public class GroupFormationScheduler {

  private final GroupFormationService formation;

  @Scheduled(
      fixedDelayString = "${pipeline.grouping.scan-interval-ms:60000}",
      initialDelayString = "${pipeline.grouping.initial-delay-ms:5000}")
  public void formGroups() {
    log.debug("grouping.tick");
    formation.formGroups();
  }
}
