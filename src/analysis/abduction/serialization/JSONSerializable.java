package analysis.abduction.serialization;

import java.io.Writer;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * States and diagnostics that can be dumped as JSON for inspection. There is no way back: summaries are never read
 * from JSON.
 */
public interface JSONSerializable {

    /**
     * @return JSON object describing <code>this</code>, see {@link JSONUtil} for the layout
     */
    JSONObject toJSON();

    /**
     * Pretty print {@link #toJSON()}
     *
     * @param out
     *            writer to write to
     * @param indentFactor
     *            number of spaces added per level of nesting, 0 for a single line
     * @throws JSONException
     *             error writing to JSON
     */
    void writeJSON(Writer out, int indentFactor) throws JSONException;
}
