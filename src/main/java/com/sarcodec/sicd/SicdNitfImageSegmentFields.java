package com.sarcodec.sicd;

import com.sarcodec.header.HeaderFields;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.sarcodec.header.FieldSpec.alpha;
import static com.sarcodec.header.FieldSpec.extended;
import static com.sarcodec.sicd.NitfFieldChecks.blankIfNull;
import static com.sarcodec.sicd.NitfFieldChecks.checked;

/**
 * Image subheader fields a SICD producer chooses. They are repeated in every image segment.
 * Values are checked against their field widths when built and read back without trailing spaces.
 */
@Value
public class SicdNitfImageSegmentFields {
    private static final int MAX_COMMENTS = 9;

    String tgtid;
    String iid2;
    SicdNitfSecurityFields security;
    String isorce;
    List<String> icom;

    @Builder(toBuilder = true)
    private SicdNitfImageSegmentFields(String tgtid, String iid2, SicdNitfSecurityFields security, String isorce,
                                       List<String> icom) {
        this.tgtid = checked(alpha("TGTID", 17), blankIfNull(tgtid));
        this.iid2 = checked(alpha("IID2", 80), blankIfNull(iid2));
        this.security = Objects.requireNonNull(security, "Image security fields cannot be null");
        this.isorce = checked(alpha("ISORCE", 42), Objects.requireNonNull(isorce, "ISORCE cannot be null"));
        var comments = icom == null ? List.<String>of() : List.copyOf(icom);
        if (comments.size() > MAX_COMMENTS) {
            throw new IllegalArgumentException("At most " + MAX_COMMENTS + " image comments allowed, got " + comments.size());
        }
        comments.forEach(comment -> checked(extended("ICOM", 80), comment));
        this.icom = comments;
    }

    void applyTo(HeaderFields fields) {
        fields.put("TGTID", tgtid).put("IID2", iid2).put("ISORCE", isorce);
        security.applyTo("IS", fields);
        fields.put("NICOM", (long) icom.size());
        for (int i = 0; i < icom.size(); i++) {
            fields.put("ICOM" + (i + 1), icom.get(i));
        }
    }

    static SicdNitfImageSegmentFields from(HeaderFields fields) {
        var comments = new ArrayList<String>();
        for (int i = 1; i <= fields.getLong("NICOM", 0); i++) {
            comments.add(fields.getString("ICOM" + i));
        }
        return builder()
                .tgtid(fields.getString("TGTID"))
                .iid2(fields.getString("IID2"))
                .security(SicdNitfSecurityFields.from("IS", fields))
                .isorce(fields.getString("ISORCE"))
                .icom(comments)
                .build();
    }
}
