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
 * File header fields a SICD producer chooses. OSTAID and the security fields are required;
 * the rest default to blank. Values are checked against their field widths when built.
 * Text fields are space-filled on write and read back without trailing spaces, so a value
 * ending in spaces does not survive a round trip unchanged.
 */
@Value
public class SicdNitfHeaderFields {
    String ostaid;
    String ftitle;
    SicdNitfSecurityFields security;
    String oname;
    String ophone;

    @Builder(toBuilder = true)
    private SicdNitfHeaderFields(String ostaid, String ftitle, SicdNitfSecurityFields security, String oname, String ophone) {
        this.ostaid = checked(alpha("OSTAID", 10), Objects.requireNonNull(ostaid, "OSTAID cannot be null"));
        this.ftitle = checked(extended("FTITLE", 80), blankIfNull(ftitle));
        this.security = Objects.requireNonNull(security, "File security fields cannot be null");
        this.oname = checked(extended("ONAME", 24), blankIfNull(oname));
        this.ophone = checked(extended("OPHONE", 18), blankIfNull(ophone));
    }

    void applyTo(HeaderFields fields) {
        fields.put("OSTAID", ostaid).put("FTITLE", ftitle).put("ONAME", oname).put("OPHONE", ophone);
        security.applyTo("FS", fields);
    }

    static SicdNitfHeaderFields from(HeaderFields fields) {
        return builder()
                .ostaid(fields.getString("OSTAID"))
                .ftitle(fields.getString("FTITLE"))
                .security(SicdNitfSecurityFields.from("FS", fields))
                .oname(fields.getString("ONAME"))
                .ophone(fields.getString("OPHONE"))
                .build();
    }
}
