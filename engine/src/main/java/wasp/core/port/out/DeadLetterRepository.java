package wasp.core.port.out;

import java.util.List;

import wasp.core.model.ingestion.DeadLetter;

/**
 * Port for messages the ingestion pipeline gave up on.
 */
public interface DeadLetterRepository {

    void record(DeadLetter deadLetter);

    /**
     * Most recent dead letters, newest first.
     */
    List<DeadLetter> findRecent(int limit);

    /**
     * Total dead letters recorded, including ones no longer retained.
     */
    long count();
}
