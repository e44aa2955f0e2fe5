package com.sarcodec.sicd;

import com.sarcodec.header.HeaderFields;
import lombok.Builder;
import lombok.Value;

import java.util.Objects;

import static com.sarcodec.header.FieldSpec.alpha;
import static com.sarcodec.header.FieldSpec.extended;
import static com.sarcodec.sicd.NitfFieldChecks.blankIfNull;
import static com.sarcodec.sicd.NitfFieldChecks.checked;

/**
 * Data extension subheader fields a SICD producer chooses. Values are checked against their
 * field widths when built and read back without trailing spaces.
 */
@Value
public class SicdNitfDesFields {
    SicdNitfSecurityFields security;
    String desshrp;
    String desshli;
    String desshlin;
    String desshabs;

    @Builder(toBuilder = true)
    private SicdNitfDesFields(SicdNitfSecurityFields security, String desshrp, String desshli, String desshlin, String desshabs) {
        this.security = Objects.requireNonNull(security, "DES security fields cannot be null");
        this.desshrp = checked(extended("DESSHRP", 40), blankIfNull(desshrp));
        this.desshli = checked(extended("DESSHLI", 20), blankIfNull(desshli));
        this.desshlin = checked(extended("DESSHLIN", 120), blankIfNull(desshlin));
        this.desshabs = checked(extended("DESSHABS", 200), blankIfNull(desshabs));
    }

    void applyTo(HeaderFields fields) {
        security.applyTo("DES", fields);
        fields.put("DESSHRP", desshrp).put("DESSHLI", desshli).put("DESSHLIN", desshlin).put("DESSHABS", desshabs);
    }

    static SicdNitfDesFields from(HeaderFields fields) {
        return builder()
                .security(SicdNitfSecurityFields.from("DES", fields))
                .desshrp(fields.getString("DESSHRP"))
                .desshli(fields.getString("DESSHLI"))
                .desshlin(fields.getString("DESSHLIN"))
                .desshabs(fields.getString("DESSHABS"))
                .build();
    }
}
