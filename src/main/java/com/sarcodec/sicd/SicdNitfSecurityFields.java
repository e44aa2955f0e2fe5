package com.sarcodec.sicd;

import com.sarcodec.header.HeaderFields;
import com.sarcodec.nitf.NitfFieldTables;
import lombok.Builder;
import lombok.Value;

import static com.sarcodec.sicd.NitfFieldChecks.blankIfNull;
import static com.sarcodec.sicd.NitfFieldChecks.checked;

/**
 * The sixteen NITF security fields. The same values are written with the {@code FS},
 * {@code IS} or {@code DES} prefix depending on the header they belong to. Only the
 * classification is required; every other field defaults to blank. Every value is checked
 * against its field width, and the classification against the allowed codes, when built.
 */
@Value
public class SicdNitfSecurityFields {
    String clas;
    String clsy;
    String code;
    String ctlh;
    String rel;
    String dctp;
    String dcdt;
    String dcxm;
    String dg;
    String dgdt;
    String cltx;
    String catp;
    String caut;
    String crsn;
    String srdt;
    String ctln;

    @Builder(toBuilder = true)
    private SicdNitfSecurityFields(String clas, String clsy, String code, String ctlh, String rel, String dctp,
                                   String dcdt, String dcxm, String dg, String dgdt, String cltx, String catp,
                                   String caut, String crsn, String srdt, String ctln) {
        if (clas == null || clas.isEmpty()) {
            throw new IllegalArgumentException("Security classification (CLAS) is required");
        }
        this.clas = clas;
        this.clsy = blankIfNull(clsy);
        this.code = blankIfNull(code);
        this.ctlh = blankIfNull(ctlh);
        this.rel = blankIfNull(rel);
        this.dctp = blankIfNull(dctp);
        this.dcdt = blankIfNull(dcdt);
        this.dcxm = blankIfNull(dcxm);
        this.dg = blankIfNull(dg);
        this.dgdt = blankIfNull(dgdt);
        this.cltx = blankIfNull(cltx);
        this.catp = blankIfNull(catp);
        this.caut = blankIfNull(caut);
        this.crsn = blankIfNull(crsn);
        this.srdt = blankIfNull(srdt);
        this.ctln = blankIfNull(ctln);
        var values = new HeaderFields();
        applyTo("", values);
        for (var spec : NitfFieldTables.securityFields("")) {
            checked(spec, values.getString(spec.getName()));
        }
    }

    public static SicdNitfSecurityFields of(String clas) {
        return builder().clas(clas).build();
    }

    void applyTo(String prefix, HeaderFields fields) {
        fields.put(prefix + "CLAS", clas)
                .put(prefix + "CLSY", clsy)
                .put(prefix + "CODE", code)
                .put(prefix + "CTLH", ctlh)
                .put(prefix + "REL", rel)
                .put(prefix + "DCTP", dctp)
                .put(prefix + "DCDT", dcdt)
                .put(prefix + "DCXM", dcxm)
                .put(prefix + "DG", dg)
                .put(prefix + "DGDT", dgdt)
                .put(prefix + "CLTX", cltx)
                .put(prefix + "CATP", catp)
                .put(prefix + "CAUT", caut)
                .put(prefix + "CRSN", crsn)
                .put(prefix + "SRDT", srdt)
                .put(prefix + "CTLN", ctln);
    }

    static SicdNitfSecurityFields from(String prefix, HeaderFields fields) {
        return builder()
                .clas(fields.getString(prefix + "CLAS"))
                .clsy(fields.getString(prefix + "CLSY"))
                .code(fields.getString(prefix + "CODE"))
                .ctlh(fields.getString(prefix + "CTLH"))
                .rel(fields.getString(prefix + "REL"))
                .dctp(fields.getString(prefix + "DCTP"))
                .dcdt(fields.getString(prefix + "DCDT"))
                .dcxm(fields.getString(prefix + "DCXM"))
                .dg(fields.getString(prefix + "DG"))
                .dgdt(fields.getString(prefix + "DGDT"))
                .cltx(fields.getString(prefix + "CLTX"))
                .catp(fields.getString(prefix + "CATP"))
                .caut(fields.getString(prefix + "CAUT"))
                .crsn(fields.getString(prefix + "CRSN"))
                .srdt(fields.getString(prefix + "SRDT"))
                .ctln(fields.getString(prefix + "CTLN"))
                .build();
    }
}
