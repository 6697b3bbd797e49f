package org.pbrtscene.loader.frontend.directive;

import org.pbrtscene.loader.frontend.param.Param;
import org.pbrtscene.loader.frontend.param.ParamList;

/**
 * One parsed directive of the scene language. The set of variants is closed: adding a directive
 * means adding a record here, a grammar to the {@link DirectiveHandlerRegistry}, and a branch to the
 * scene builder.
 * <p>
 * Variants fall into three families: transform directives, scope and graph directives, and
 * resource directives, most of which carry a type name and a {@link ParamList}.
 * Directive records are transient: they are consumed by the builder right after parsing.
 */
public sealed interface Directive {

    // region Files & global options

    /** {@code Include "path"} */
    record Include(String path) implements Directive {}

    /** {@code Import "path"} */
    record Import(String path) implements Directive {}

    /** {@code Option "type name" value} */
    record Option(Param param) implements Directive {}

    /** {@code ColorSpace "name"} */
    record ColorSpace(String name) implements Directive {}

    // endregion

    // region Header resources

    /** {@code Film "type" params} */
    record Film(String type, ParamList params) implements Directive {}

    /** {@code Camera "type" params} */
    record Camera(String type, ParamList params) implements Directive {}

    /** {@code Sampler "type" params} */
    record Sampler(String type, ParamList params) implements Directive {}

    /** {@code Integrator "type" params} */
    record Integrator(String type, ParamList params) implements Directive {}

    /** {@code Accelerator "type" params} */
    record Accelerator(String type, ParamList params) implements Directive {}

    /** {@code PixelFilter "type" params} */
    record PixelFilter(String type, ParamList params) implements Directive {}

    // endregion

    // region Transforms

    /** {@code Identity} */
    record Identity() implements Directive {}

    /** {@code Translate x y z} */
    record Translate(float x, float y, float z) implements Directive {}

    /** {@code Scale x y z} */
    record Scale(float x, float y, float z) implements Directive {}

    /** {@code Rotate angle x y z}, angle in degrees. */
    record Rotate(float angle, float x, float y, float z) implements Directive {}

    /** {@code LookAt eye_x eye_y eye_z look_x look_y look_z up_x up_y up_z} */
    record LookAt(float eyeX, float eyeY, float eyeZ,
                  float lookX, float lookY, float lookZ,
                  float upX, float upY, float upZ) implements Directive {}

    /**
     * {@code Transform [ m00 ... m33 ]}, 16 floats in column-major order.
     * The array is owned by the record and must not be modified.
     */
    record Transform(float[] matrix) implements Directive {}

    /** {@code ConcatTransform [ m00 ... m33 ]}, 16 floats in column-major order. */
    record ConcatTransform(float[] matrix) implements Directive {}

    /** {@code CoordinateSystem "name"} */
    record CoordinateSystem(String name) implements Directive {}

    /** {@code CoordSysTransform "name"} */
    record CoordSysTransform(String name) implements Directive {}

    /** {@code TransformTimes start end} */
    record TransformTimes(float start, float end) implements Directive {}

    /** {@code ActiveTransform StartTime|EndTime|All} */
    record ActiveTransform(String which) implements Directive {}

    /** {@code ReverseOrientation} */
    record ReverseOrientation() implements Directive {}

    // endregion

    // region Scope

    /** {@code WorldBegin} */
    record WorldBegin() implements Directive {}

    /** {@code AttributeBegin} */
    record AttributeBegin() implements Directive {}

    /** {@code AttributeEnd} */
    record AttributeEnd() implements Directive {}

    /** {@code Attribute "target" params} */
    record Attribute(String target, ParamList params) implements Directive {}

    /** {@code ObjectBegin "name"} */
    record ObjectBegin(String name) implements Directive {}

    /** {@code ObjectEnd} */
    record ObjectEnd() implements Directive {}

    /** {@code ObjectInstance "name"} */
    record ObjectInstance(String name) implements Directive {}

    // endregion

    // region World resources

    /** {@code LightSource "type" params} */
    record LightSource(String type, ParamList params) implements Directive {}

    /** {@code AreaLightSource "type" params} */
    record AreaLightSource(String type, ParamList params) implements Directive {}

    /** {@code Material "type" params} */
    record Material(String type, ParamList params) implements Directive {}

    /** {@code MakeNamedMaterial "name" params}; the material type is the {@code "string type"} parameter. */
    record MakeNamedMaterial(String name, ParamList params) implements Directive {}

    /** {@code NamedMaterial "name"} */
    record NamedMaterial(String name) implements Directive {}

    /** {@code Texture "name" "float|spectrum" "class" params} */
    record Texture(String name, String valueType, String textureClass, ParamList params) implements Directive {}

    /** {@code Shape "type" params} */
    record Shape(String type, ParamList params) implements Directive {}

    /** {@code MakeNamedMedium "name" params}; the medium type is the {@code "string type"} parameter. */
    record MakeNamedMedium(String name, ParamList params) implements Directive {}

    /** {@code MediumInterface "interior" ["exterior"]} */
    record MediumInterface(String interior, String exterior) implements Directive {}

    // endregion
}
