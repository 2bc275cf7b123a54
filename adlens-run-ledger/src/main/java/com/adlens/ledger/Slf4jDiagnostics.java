package com.adlens.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Diagnostics sink that writes each event to the SLF4J logger named after the event source.
 */
public final class Slf4jDiagnostics implements Diagnostics {

    @Override
    public void record(DiagnosticEvent event) {
        Logger logger = LoggerFactory.getLogger(event.source());
        switch (event.level()) {
            case ERROR:
                if (event.cause() != null) {
                    logger.error(event.message(), event.cause());
                } else {
                    logger.error(event.message());
                }
                break;
            case WARN:
                logger.warn(event.message());
                break;
            default:
                logger.info(event.message());
                break;
        }
    }
}
