package io.riff.core.call;

import io.riff.core.session.Layer;
import io.riff.core.session.LayerAttributes;
import io.riff.core.session.Session;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders calls as FoxDot live-coding statements.
 */
public final class FoxDotCodeBuilder implements CodeBuilder {
    public static final String DEFAULT_SYNTH_DUR = "1";
    public static final double DEFAULT_SYNTH_AMP = 0.7;
    public static final int DEFAULT_SYNTH_OCT = 5;
    public static final String DEFAULT_DRUM_DUR = "0.5";
    public static final double DEFAULT_DRUM_AMP = 0.8;
    public static final String PERCUSSION_SYNTH = "play";

    @Override
    public String build(CallKind kind, CallArguments arguments, Session session) throws CodeBuildException {
        return switch (kind) {
            case PLAY_SYNTH -> synth(arguments);
            case PLAY_DRUMS -> drums(arguments);
            case SET_TEMPO -> "Clock.bpm = " + arguments.requireInteger("bpm");
            case SET_SCALE -> "Scale.default = Scale." + arguments.requireIdentifier("scale");
            case SET_ROOT -> "Root.default = \"" + quoted(arguments.requireString("root")) + "\"";
            case STOP_PLAYER -> arguments.requireIdentifier("player") + ".stop()";
            case STOP_ALL -> "Clock.clear()";
            case MODIFY_LAYER -> modify(arguments, session);
            case EXECUTE_CODE -> arguments.requireString("code");
            case GET_SESSION_STATE -> throw new CodeBuildException("get_session_state does not produce code");
        };
    }

    private String synth(CallArguments arguments) throws CodeBuildException {
        String player = arguments.requireIdentifier("player");
        String synth = arguments.requireIdentifier("synth");
        List<String> params = new ArrayList<>();
        params.add(arguments.requirePitchSequence("notes"));
        params.add("dur=" + arguments.optionalString("dur").orElse(DEFAULT_SYNTH_DUR));
        params.add("amp=" + CallArguments.formatNumber(arguments.optionalDouble("amp").orElse(DEFAULT_SYNTH_AMP)));
        params.add("oct=" + arguments.optionalInteger("oct").orElse(DEFAULT_SYNTH_OCT));
        appendEffects(params, arguments.effects("effects"));
        return player + " >> " + synth + "(" + String.join(", ", params) + ")";
    }

    private String drums(CallArguments arguments) throws CodeBuildException {
        String player = arguments.requireIdentifier("player");
        String pattern = arguments.requireString("pattern");
        if (pattern.contains("\"") || pattern.contains("\n")) {
            throw new CodeBuildException("Pattern must not contain quotes or line breaks");
        }
        List<String> params = new ArrayList<>();
        params.add("\"" + pattern + "\"");
        params.add("dur=" + arguments.optionalString("dur").orElse(DEFAULT_DRUM_DUR));
        params.add("amp=" + CallArguments.formatNumber(arguments.optionalDouble("amp").orElse(DEFAULT_DRUM_AMP)));
        appendEffects(params, arguments.effects("effects"));
        return player + " >> " + PERCUSSION_SYNTH + "(" + String.join(", ", params) + ")";
    }

    private String modify(CallArguments arguments, Session session) throws CodeBuildException {
        String player = arguments.requireIdentifier("player");
        Layer layer = session.layer(player)
            .orElseThrow(() -> new CodeBuildException("Player " + player + " not found"));
        LayerAttributes merged = layer.attributes().merge(
            arguments.optionalDouble("amp").orElse(null),
            arguments.optionalInteger("oct").orElse(null),
            arguments.effects("effects")
        );

        List<String> params = new ArrayList<>();
        if (PERCUSSION_SYNTH.equals(layer.synth())) {
            if (merged.pattern() == null) {
                throw new CodeBuildException("Layer " + player + " has no pattern to re-render");
            }
            params.add("\"" + merged.pattern() + "\"");
        } else {
            if (merged.notes() == null) {
                throw new CodeBuildException("Layer " + player + " has no pitch sequence to re-render");
            }
            params.add(merged.notes());
        }
        if (merged.dur() != null) {
            params.add("dur=" + merged.dur());
        }
        if (merged.amp() != null) {
            params.add("amp=" + CallArguments.formatNumber(merged.amp()));
        }
        if (merged.oct() != null) {
            params.add("oct=" + merged.oct());
        }
        appendEffects(params, merged.effects());
        return player + " >> " + layer.synth() + "(" + String.join(", ", params) + ")";
    }

    private void appendEffects(List<String> params, Map<String, Object> effects) {
        for (Map.Entry<String, Object> effect : effects.entrySet()) {
            params.add(effect.getKey() + "=" + CallArguments.formatValue(effect.getValue()));
        }
    }

    private String quoted(String value) {
        return value.replace("\\", "").replace("\"", "");
    }
}
