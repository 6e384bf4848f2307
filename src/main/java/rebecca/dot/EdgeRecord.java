package rebecca.dot;

import java.util.Objects;

/**
 * Graphviz edge statement from a parent to one of its children.
 */
public class EdgeRecord {

	public final long from;
	public final long to;

	public EdgeRecord(long from, long to) {
		this.from = from;
		this.to = to;
	}

	public String toGraphvizString(){
		return TreeExporter.nodeName(from) + " -> " + TreeExporter.nodeName(to);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof EdgeRecord)){
			return false;
		}
		EdgeRecord other = (EdgeRecord) o;
		return from == other.from && to == other.to;
	}

	@Override
	public int hashCode() {
		return Objects.hash(from, to);
	}

	@Override
	public String toString() {
		return toGraphvizString();
	}
}
