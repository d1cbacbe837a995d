package ca.gc.cra.premis.application.port;

import ca.gc.cra.premis.domain.premis.PremisAgent;
import ca.gc.cra.premis.domain.premis.PremisEvent;
import ca.gc.cra.premis.domain.premis.PremisObject;
import ca.gc.cra.premis.domain.premis.PremisRights;
import java.util.List;

/**
 * <strong>What:</strong> Input port exposing the typed records parsed from one document.
 * <p><strong>Why:</strong> Lets the record aggregate populate itself without binding to a markup parser.</p>
 * <p><strong>Role:</strong> Import-side port; obtained from a {@link DocumentImporterFactory} for a location.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return fully constructed records of each kind in document order.</li>
 *   <li>Ignore document order across kinds; callers choose the order in which kinds are consumed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations are read-only after construction.</p>
 *
 * @since 0.1.0
 * @see DocumentExporter
 */
public interface DocumentImporter {
  /**
   * Returns every event record in the document.
   *
   * @return events in document order; never {@code null}
   */
  List<PremisEvent> findEvents();

  /**
   * Returns every agent record in the document.
   *
   * @return agents in document order; never {@code null}
   */
  List<PremisAgent> findAgents();

  /**
   * Returns every rights record in the document.
   *
   * @return rights in document order; never {@code null}
   */
  List<PremisRights> findRights();

  /**
   * Returns every object record in the document.
   *
   * @return objects in document order; never {@code null}
   */
  List<PremisObject> findObjects();
}
