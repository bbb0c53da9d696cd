package ca.gc.cra.logmerge.api;

import ca.gc.cra.logmerge.application.port.MergeErrorSink;
import ca.gc.cra.logmerge.domain.merge.SourceFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link MergeErrorSink} that logs each failed source at ERROR. */
final class LoggingErrorSink implements MergeErrorSink {
  private static final Logger log = LoggerFactory.getLogger(LoggingErrorSink.class);

  @Override
  public void report(SourceFailure failure) {
    log.error("Source {} failed; merge continues with the remaining sources",
        failure.sourceLabel(), failure.cause());
  }
}
