package me.golemcore.runtime.domain.model.confirmation;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class InfoConfirmationDetails extends ConfirmationDetails {

    private String prompt;
    private List<String> urls;
}
