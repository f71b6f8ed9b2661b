package theoremis.model.term;

/**
 * Either Prop or Type at a non-negative level. By convention Type n : Type (n+1),
 * but levels are not checked for consistency.
 */
public final class Universe {
	private static final Universe PROP = new Universe(true, 0);

	private final boolean prop;
	private final int level;

	private Universe(boolean prop, int level) {
		this.prop = prop;
		this.level = level;
	}

	public static Universe prop() {
		return PROP;
	}

	public static Universe type(int level) {
		if (level < 0) {
			throw new IllegalArgumentException("universe level must be non-negative, got " + level);
		}
		return new Universe(false, level);
	}

	public boolean isProp() {
		return prop;
	}

	/**
	 * @return the level of a Type universe; 0 for Prop
	 */
	public int getLevel() {
		return level;
	}

	@Override
	public int hashCode() {
		return prop ? 1 : level * 17 + 2;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Universe)) {
			return false;
		}
		Universe other = (Universe) obj;
		return prop == other.prop && level == other.level;
	}

	@Override
	public String toString() {
		return prop ? "Prop" : "Type " + level;
	}
}
