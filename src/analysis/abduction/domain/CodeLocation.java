package analysis.abduction.domain;

/**
 * Position in the analyzed source code
 */
public final class CodeLocation {

    /**
     * Location used when nothing better is known
     */
    public static final CodeLocation NONE = new CodeLocation("<unknown>", -1);

    /**
     * Source file
     */
    private final String file;
    /**
     * Line number, -1 if unknown
     */
    private final int line;

    public CodeLocation(String file, int line) {
        this.file = file;
        this.line = line;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + ((file == null) ? 0 : file.hashCode());
        result = prime * result + line;
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null) {
            return false;
        }
        if (getClass() != obj.getClass()) {
            return false;
        }
        CodeLocation other = (CodeLocation) obj;
        if (file == null) {
            if (other.file != null) {
                return false;
            }
        }
        else if (!file.equals(other.file)) {
            return false;
        }
        return line == other.line;
    }

    @Override
    public String toString() {
        return line < 0 ? file : file + ":" + line;
    }
}
