package com.journeytide.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
@Getter @Setter @NoArgsConstructor
public class ExitPaths {

    private ExitPath sent;

    private ExitPath delivered;

    private ExitPath read;

    private ExitPath failed;

    private List<ButtonExitPath> buttonClicked = new ArrayList<>();

    /**
     * Picks the enabled exit path for a callback. Button clicks are matched by
     * button id; every other kind has a single slot.
     */
    public Optional<ExitPath> resolve(CallbackKind kind, String buttonId) {
        ExitPath path = switch (kind) {
            case SENT -> sent;
            case DELIVERED -> delivered;
            case READ -> read;
            case FAILED -> failed;
            case BUTTON_CLICKED -> buttonClicked == null ? null : buttonClicked.stream()
                    .filter(candidate -> candidate.matches(buttonId))
                    .findFirst()
                    .orElse(null);
        };
        if (path == null || !path.isEnabled() || path.getAction() == null
                || path.getAction().getType() == null) {
            return Optional.empty();
        }
        return Optional.of(path);
    }
}
