package edu.brandeis.cosi103a.brackets.standings;

/**
 * One entry of a team's recent form. A bye counts as a win.
 */
public enum ResultMark {
    W,
    L
}
