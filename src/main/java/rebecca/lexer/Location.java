package rebecca.lexer;

import java.util.Objects;

/**
 * Line and column (both starting at one) of a lexeme in the source code.
 */
public class Location {

	public static final Location START = new Location(1, 1);

	public final int line;
	public final int column;

	public Location(int line, int column){
		this.line = line;
		this.column = column;
	}

	/**
	 * Location directly after the passed character
	 */
	public Location after(char c){
		if (c == '\n'){
			return new Location(line + 1, 1);
		}
		return new Location(line, column + 1);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Location)){
			return false;
		}
		Location other = (Location) o;
		return line == other.line && column == other.column;
	}

	@Override
	public int hashCode() {
		return Objects.hash(line, column);
	}

	@Override
	public String toString() {
		return "[" + line + ":" + column + "]";
	}
}
