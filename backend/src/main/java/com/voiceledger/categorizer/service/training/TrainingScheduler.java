package com.voiceledger.categorizer.service.training;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.voiceledger.categorizer.dto.training.TrainingResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Periodic full retraining; disabled unless {@code categorizer.training.schedule} is a cron. */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrainingScheduler {

  private final ModelTrainingService modelTrainingService;

  @Scheduled(cron = "${categorizer.training.schedule:-}")
  public void retrain() {
    log.info("Scheduled retraining started");
    TrainingResult result = modelTrainingService.train();
    log.info("Scheduled retraining finished: {} ({})", result.getStatus(), result.getMessage());
  }
}
