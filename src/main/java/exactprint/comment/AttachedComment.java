package exactprint.comment;

import exactprint.util.SourcePosition;

/**
 * A comment floated onto a node during annotation construction. It may still be stored relative to
 * the node, so it is resolved against the printer's cursor at the moment the node is visited.
 */
public interface AttachedComment {

  Comment resolve(SourcePosition cursor);
}
