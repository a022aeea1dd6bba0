package com.example.blockalert.mapper;

import com.example.blockalert.dto.AlertView;
import com.example.blockalert.model.Alert;
import com.example.blockalert.model.AlertResponse;
import com.example.blockalert.util.Constants.UrgencyLevel;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.util.List;

@Mapper(componentModel = "spring")
public abstract class AlertMapper {

    // Enums go out as their lower-case wire values, not their constant names
    @Mapping(source = "urgency", target = "urgency", qualifiedByName = "urgencyWireValue")
    @Mapping(source = "response", target = "response", qualifiedByName = "responseWireValue")
    @Mapping(source = "response", target = "responseText", qualifiedByName = "responseDisplayText")
    public abstract AlertView toView(Alert alert);

    public abstract List<AlertView> toViews(List<Alert> alerts);

    @Named("urgencyWireValue")
    protected String urgencyWireValue(UrgencyLevel urgency) {
        return urgency != null ? urgency.wireValue() : null;
    }

    @Named("responseWireValue")
    protected String responseWireValue(AlertResponse response) {
        return response != null ? response.getWireValue() : null;
    }

    @Named("responseDisplayText")
    protected String responseDisplayText(AlertResponse response) {
        return response != null ? response.getDisplayText() : null;
    }
}
