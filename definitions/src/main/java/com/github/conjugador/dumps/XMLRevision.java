package com.github.conjugador.dumps;

import java.util.Objects;

import com.github.conjugador.utils.PageContainer;

public class XMLRevision {
    String title;
    int ns;
    long pageid;
    boolean isRedirect;
    long revid;
    String timestamp;
    String text;

    XMLRevision() {
        title = "";
        text = ""; // might be missing if revdeleted
    }

    public String getTitle() {
        return title;
    }

    public int getNamespace() {
        return ns;
    }

    public long getPageid() {
        return pageid;
    }

    public boolean isRedirect() {
        return isRedirect;
    }

    public long getRevid() {
        return revid;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public String getText() {
        return text;
    }

    public boolean isMainNamespace() {
        return ns == 0;
    }

    public boolean nonRedirect() {
        return !isRedirect;
    }

    public PageContainer toPageContainer() {
        return new PageContainer(title, text);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(revid);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        } else if (obj instanceof XMLRevision rev) {
            return revid == rev.revid && pageid == rev.pageid && Objects.equals(title, rev.title);
        } else {
            return false;
        }
    }

    @Override
    public String toString() {
        return
            "[title=" + title +
            ",ns=" + ns +
            ",pageid=" + pageid +
            ",isRedirect=" + isRedirect +
            ",revid=" + revid +
            ",timestamp=" + timestamp +
            ",text=" + text + "]";
    }
}
