package verilogast.graph;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.ToIntFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import verilogast.ast.AstContractException;

/**
 * Name to node id map that lets repeated uses of a name share one node.
 * Entries are never removed; the table lives as long as its graph.
 */
public class IdentifierTable {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final String tableName;
  private final HashMap<String, Integer> ids = new HashMap<>();

  /**
   * @param tableName name of the table for log messages
   */
  public IdentifierTable(String tableName) { this.tableName = tableName; }

  /**
   * Returns the id stored for a name, allocating a new node through the given function on a miss.
   * @param name the identifier text, compared by exact string equality
   * @param allocator creates the node for a new name and returns its id
   * @return the id of the node for the name
   */
  public int intern(String name, ToIntFunction<String> allocator) {
    if (name == null)
      throw new AstContractException("Cannot intern a null name in " + tableName);
    Integer existing = ids.get(name);
    if (existing != null) {
      logger.trace("{}: reusing id {} for '{}'", tableName, existing, name);
      return existing;
    }
    int id = allocator.applyAsInt(name);
    ids.put(name, id);
    logger.trace("{}: '{}' -> {} ({} entries)", tableName, name, id, ids.size());
    return id;
  }

  /**
   * Looks up a name without allocating.
   * @param name the identifier text
   * @return the id wrapped in AstOrError, or an invalid AstOrError if the name is unknown
   */
  public AstOrError lookup(String name) {
    Integer existing = ids.get(name);
    return existing == null ? AstOrError.error() : AstOrError.of(existing);
  }

  public boolean contains(String name) { return ids.containsKey(name); }
  public int size() { return ids.size(); }
  public String getTableName() { return tableName; }
  /** Returns a read-only view of all entries. */
  public Map<String, Integer> entries() { return Collections.unmodifiableMap(ids); }
}
