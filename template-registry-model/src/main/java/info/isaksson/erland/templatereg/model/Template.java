package info.isaksson.erland.templatereg.model;

/**
 * Opaque handle to a renderable template. The registry never looks inside.
 */
public interface Template {

    /** Short description used in diagnostics and reports. */
    String describe();
}
