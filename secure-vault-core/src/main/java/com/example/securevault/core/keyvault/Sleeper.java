package com.example.securevault.core.keyvault;

import java.time.Duration;

/** Pauses the calling thread. */
@FunctionalInterface
interface Sleeper {

  Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
