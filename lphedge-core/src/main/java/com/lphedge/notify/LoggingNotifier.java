package com.lphedge.notify;

import com.lphedge.hedge.port.Notifier;
import lombok.extern.slf4j.Slf4j;

/**
 * Used when chat notifications are disabled: the status text goes to the application log.
 */
@Slf4j
public final class LoggingNotifier implements Notifier {

  @Override
  public void push(String text) {
    log.info("lph status\n{}", text);
  }
}
