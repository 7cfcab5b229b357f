package analysis.abduction.domain;

/**
 * Element of an abstract domain used by the biabductive analysis. These domains have no join: disjunctions are kept
 * as separate pre/post pairs by the driver.
 *
 * @param <T>
 *            Type of the implementing class (e.g. MyState implements AbstractValue&ltMyState&gt)
 */
public interface AbstractValue<T> {

    /**
     * Is this abstract value less than or equal to the given abstract value
     *
     * @param that
     *            value to compare
     * @return true if this is less than or equal to that
     */
    boolean leq(T that);

    /**
     * Is this the bottom element, i.e., the state with no bindings and no cells
     *
     * @return true if this is the bottom element
     */
    boolean isBottom();
}
