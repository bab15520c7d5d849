package org.springaicommunity.review.discussion;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springaicommunity.review.discussion.DiscussionFixtures.*;

/**
 * Tests for the {@link Discussion} resolution aggregate.
 *
 * <p>
 * Notes are Mockito spies so that the fan-out of resolve/unresolve can be verified per
 * note, including notes that must never be touched.
 */
@DisplayName("Discussion Tests")
class DiscussionTest {

	private Note firstNote;

	private Note secondNote;

	private Note thirdNote;

	private Authorizer authorizer;

	private Discussion subject;

	@BeforeEach
	void setUp() {
		firstNote = spy(diffNote(1));
		secondNote = spy(diffNote(2));
		thirdNote = spy(diffNote(3));
		authorizer = mock(Authorizer.class);
		subject = new Discussion(MERGE_REQUEST, List.of(firstNote, secondNote, thirdNote), true, true, authorizer);
	}

	private void onlyFirstAndThirdResolvable() {
		doReturn(true).when(firstNote).isResolvable();
		doReturn(false).when(secondNote).isResolvable();
		doReturn(true).when(thirdNote).isResolvable();
	}

	private Discussion notResolvable(Discussion discussion) {
		Discussion stubbed = spy(discussion);
		doReturn(false).when(stubbed).isResolvable();
		return stubbed;
	}

	@Nested
	@DisplayName("isResolvable")
	class ResolvableTest {

		@Test
		@DisplayName("Should be false when all notes are unresolvable")
		void shouldBeFalseWhenAllNotesUnresolvable() {
			doReturn(false).when(firstNote).isResolvable();
			doReturn(false).when(secondNote).isResolvable();
			doReturn(false).when(thirdNote).isResolvable();

			assertThat(subject.isResolvable()).isFalse();
		}

		@Test
		@DisplayName("Should be true when some notes are resolvable")
		void shouldBeTrueWhenSomeNotesResolvable() {
			onlyFirstAndThirdResolvable();

			assertThat(subject.isResolvable()).isTrue();
		}

		@Test
		@DisplayName("Should be true when all notes are resolvable")
		void shouldBeTrueWhenAllNotesResolvable() {
			assertThat(subject.isResolvable()).isTrue();
		}

		@Test
		@DisplayName("Should be false for a non-diff discussion regardless of notes")
		void shouldBeFalseForNonDiffDiscussion() {
			Discussion plain = new Discussion(MERGE_REQUEST, List.of(firstNote, secondNote, thirdNote), false, true,
					authorizer);

			assertThat(plain.isResolvable()).isFalse();
		}

	}

	@Nested
	@DisplayName("isResolved")
	class ResolvedTest {

		@Test
		@DisplayName("Should be false when not resolvable even if notes are resolved")
		void shouldBeFalseWhenNotResolvable() {
			firstNote.resolve(User.of("alice"));
			secondNote.resolve(User.of("alice"));
			thirdNote.resolve(User.of("alice"));

			assertThat(notResolvable(subject).isResolved()).isFalse();
		}

		@Test
		@DisplayName("Should be true when all resolvable notes are resolved")
		void shouldBeTrueWhenAllResolvableNotesResolved() {
			onlyFirstAndThirdResolvable();
			doReturn(true).when(firstNote).isResolved();
			doReturn(true).when(thirdNote).isResolved();

			assertThat(subject.isResolved()).isTrue();
		}

		@Test
		@DisplayName("Should be false when some resolvable notes are not resolved")
		void shouldBeFalseWhenSomeResolvableNotesUnresolved() {
			onlyFirstAndThirdResolvable();
			doReturn(true).when(firstNote).isResolved();
			doReturn(false).when(thirdNote).isResolved();

			assertThat(subject.isResolved()).isFalse();
		}

		@Test
		@DisplayName("Should ignore the state of unresolvable notes")
		void shouldIgnoreUnresolvableNotes() {
			onlyFirstAndThirdResolvable();
			doReturn(true).when(firstNote).isResolved();
			doReturn(false).when(secondNote).isResolved();
			doReturn(true).when(thirdNote).isResolved();

			assertThat(subject.isResolved()).isTrue();
		}

	}

	@Nested
	@DisplayName("isToBeResolved")
	class ToBeResolvedTest {

		@Test
		@DisplayName("Should be false when not resolvable")
		void shouldBeFalseWhenNotResolvable() {
			assertThat(notResolvable(subject).isToBeResolved()).isFalse();
		}

		@Test
		@DisplayName("Should be false when all resolvable notes are resolved")
		void shouldBeFalseWhenAllResolved() {
			onlyFirstAndThirdResolvable();
			doReturn(true).when(firstNote).isResolved();
			doReturn(true).when(thirdNote).isResolved();

			assertThat(subject.isToBeResolved()).isFalse();
		}

		@Test
		@DisplayName("Should be true when some resolvable notes are not resolved")
		void shouldBeTrueWhenSomeUnresolved() {
			onlyFirstAndThirdResolvable();
			doReturn(true).when(firstNote).isResolved();
			doReturn(false).when(thirdNote).isResolved();

			assertThat(subject.isToBeResolved()).isTrue();
		}

	}

	@Nested
	@DisplayName("canResolve")
	class CanResolveTest {

		private final User currentUser = User.of("current-user");

		@Test
		@DisplayName("Should be false when not resolvable")
		void shouldBeFalseWhenNotResolvable() {
			assertThat(notResolvable(subject).canResolve(AUTHOR)).isFalse();
			verifyNoInteractions(authorizer);
		}

		@Test
		@DisplayName("Should be false when not signed in")
		void shouldBeFalseWhenNotSignedIn() {
			assertThat(subject.canResolve(null)).isFalse();
			verifyNoInteractions(authorizer);
		}

		@Test
		@DisplayName("Should be true for the noteable author without push access")
		void shouldBeTrueForNoteableAuthor() {
			assertThat(subject.canResolve(User.of(AUTHOR.username()))).isTrue();
		}

		@Test
		@DisplayName("Should be true for a user who can push to the project")
		void shouldBeTrueForUserWithPushAccess() {
			when(authorizer.canPush(currentUser, PROJECT)).thenReturn(true);

			assertThat(subject.canResolve(currentUser)).isTrue();
		}

		@Test
		@DisplayName("Should be false for a random user")
		void shouldBeFalseForRandomUser() {
			when(authorizer.canPush(any(), any())).thenReturn(false);

			assertThat(subject.canResolve(currentUser)).isFalse();
			verify(authorizer).canPush(currentUser, PROJECT);
		}

	}

	@Nested
	@DisplayName("resolve")
	class ResolveTest {

		private final User currentUser = User.of("current-user");

		private final User earlierUser = User.of("earlier-user");

		@Nested
		@DisplayName("When not resolvable")
		class WhenNotResolvable {

			private Discussion discussion;

			@BeforeEach
			void setUp() {
				discussion = notResolvable(subject);
			}

			@Test
			@DisplayName("Should return nothing and touch no note")
			void shouldReturnNothing() {
				assertThat(discussion.resolve(currentUser)).isEmpty();

				verify(firstNote, never()).resolve(any());
				verify(secondNote, never()).resolve(any());
				verify(thirdNote, never()).resolve(any());
			}

			@Test
			@DisplayName("Should not set resolvedAt, resolvedBy or resolved")
			void shouldNotMarkAsResolved() {
				discussion.resolve(currentUser);

				assertThat(discussion.resolvedAt()).isNull();
				assertThat(discussion.resolvedBy()).isNull();
				assertThat(discussion.isResolved()).isFalse();
			}

		}

		@Nested
		@DisplayName("When all resolvable notes are resolved")
		class WhenAllResolved {

			@BeforeEach
			void setUp() {
				onlyFirstAndThirdResolvable();
				firstNote.resolve(earlierUser);
				thirdNote.resolve(earlierUser);
				clearInvocations(firstNote, secondNote, thirdNote);
			}

			@Test
			@DisplayName("Should call resolve on every resolvable note only")
			void shouldCallResolveOnEveryResolvableNote() {
				subject.resolve(currentUser);

				verify(firstNote).resolve(currentUser);
				verify(secondNote, never()).resolve(any());
				verify(thirdNote).resolve(currentUser);
			}

			@Test
			@DisplayName("Should keep the original resolution of the notes")
			void shouldKeepOriginalResolution() {
				LocalDateTime firstResolvedAt = firstNote.getResolvedAt();
				LocalDateTime thirdResolvedAt = thirdNote.getResolvedAt();

				List<Note> changed = subject.resolve(currentUser);

				assertThat(changed).isEmpty();
				assertThat(firstNote.getResolvedAt()).isEqualTo(firstResolvedAt);
				assertThat(thirdNote.getResolvedAt()).isEqualTo(thirdResolvedAt);
				assertThat(firstNote.getResolvedBy()).isEqualTo(earlierUser);
				assertThat(thirdNote.getResolvedBy()).isEqualTo(earlierUser);
				assertThat(firstNote.isResolved()).isTrue();
				assertThat(thirdNote.isResolved()).isTrue();
			}

			@Test
			@DisplayName("Should keep the discussion resolution")
			void shouldKeepDiscussionResolution() {
				LocalDateTime resolvedAt = subject.resolvedAt();
				assertThat(resolvedAt).isNotNull();
				assertThat(subject.resolvedBy()).isEqualTo(earlierUser);

				subject.resolve(currentUser);

				assertThat(subject.resolvedAt()).isEqualTo(resolvedAt);
				assertThat(subject.resolvedBy()).isEqualTo(earlierUser);
				assertThat(subject.isResolved()).isTrue();
			}

		}

		@Nested
		@DisplayName("When some resolvable notes are resolved")
		class WhenSomeResolved {

			@BeforeEach
			void setUp() {
				onlyFirstAndThirdResolvable();
				firstNote.resolve(earlierUser);
				clearInvocations(firstNote, secondNote, thirdNote);
			}

			@Test
			@DisplayName("Should call resolve on every resolvable note only")
			void shouldCallResolveOnEveryResolvableNote() {
				subject.resolve(currentUser);

				verify(firstNote).resolve(currentUser);
				verify(secondNote, never()).resolve(any());
				verify(thirdNote).resolve(currentUser);
			}

			@Test
			@DisplayName("Should keep the already resolved note unchanged")
			void shouldKeepResolvedNoteUnchanged() {
				LocalDateTime resolvedAt = firstNote.getResolvedAt();

				subject.resolve(currentUser);

				assertThat(firstNote.getResolvedAt()).isEqualTo(resolvedAt);
				assertThat(firstNote.getResolvedBy()).isEqualTo(earlierUser);
				assertThat(firstNote.isResolved()).isTrue();
			}

			@Test
			@DisplayName("Should resolve the unresolved note and report it as changed")
			void shouldResolveUnresolvedNote() {
				List<Note> changed = subject.resolve(currentUser);

				assertThat(changed).containsExactly(thirdNote);
				assertThat(thirdNote.getResolvedAt()).isEqualTo(FIXED_NOW);
				assertThat(thirdNote.getResolvedBy()).isEqualTo(currentUser);
				assertThat(thirdNote.isResolved()).isTrue();
			}

			@Test
			@DisplayName("Should mark the discussion as resolved")
			void shouldMarkDiscussionAsResolved() {
				subject.resolve(currentUser);

				assertThat(subject.isResolved()).isTrue();
				assertThat(subject.resolvedAt()).isNotNull();
				// first resolved resolvable note wins
				assertThat(subject.resolvedBy()).isEqualTo(earlierUser);
			}

		}

		@Nested
		@DisplayName("When no resolvable notes are resolved")
		class WhenNoneResolved {

			@BeforeEach
			void setUp() {
				onlyFirstAndThirdResolvable();
			}

			@Test
			@DisplayName("Should call resolve on every resolvable note only")
			void shouldCallResolveOnEveryResolvableNote() {
				subject.resolve(currentUser);

				verify(firstNote).resolve(currentUser);
				verify(secondNote, never()).resolve(any());
				verify(thirdNote).resolve(currentUser);
			}

			@Test
			@DisplayName("Should resolve every resolvable note")
			void shouldResolveEveryResolvableNote() {
				List<Note> changed = subject.resolve(currentUser);

				assertThat(changed).containsExactly(firstNote, thirdNote);
				assertThat(firstNote.getResolvedAt()).isEqualTo(FIXED_NOW);
				assertThat(thirdNote.getResolvedAt()).isEqualTo(FIXED_NOW);
				assertThat(firstNote.getResolvedBy()).isEqualTo(currentUser);
				assertThat(thirdNote.getResolvedBy()).isEqualTo(currentUser);
				assertThat(secondNote.isResolved()).isFalse();
			}

			@Test
			@DisplayName("Should mark the discussion as resolved by the user")
			void shouldMarkDiscussionAsResolved() {
				subject.resolve(currentUser);

				assertThat(subject.isResolved()).isTrue();
				assertThat(subject.resolvedAt()).isEqualTo(FIXED_NOW);
				assertThat(subject.resolvedBy()).isEqualTo(currentUser);
			}

		}

	}

	@Nested
	@DisplayName("unresolve")
	class UnresolveTest {

		private final User user = User.of("alice");

		@Test
		@DisplayName("Should return nothing and touch no note when not resolvable")
		void shouldDoNothingWhenNotResolvable() {
			firstNote.resolve(user);
			clearInvocations(firstNote);

			assertThat(notResolvable(subject).unresolve()).isEmpty();

			verify(firstNote, never()).unresolve();
			verify(secondNote, never()).unresolve();
			verify(thirdNote, never()).unresolve();
			assertThat(firstNote.isResolved()).isTrue();
		}

		@Nested
		@DisplayName("When resolvable")
		class WhenResolvable {

			@BeforeEach
			void setUp() {
				onlyFirstAndThirdResolvable();
			}

			@Test
			@DisplayName("Should call unresolve on every resolvable note only")
			void shouldCallUnresolveOnEveryResolvableNote() {
				subject.unresolve();

				verify(firstNote).unresolve();
				verify(secondNote, never()).unresolve();
				verify(thirdNote).unresolve();
			}

			@Test
			@DisplayName("Should clear all resolutions when all notes are resolved")
			void shouldClearAllResolutions() {
				firstNote.resolve(user);
				thirdNote.resolve(user);

				List<Note> changed = subject.unresolve();

				assertThat(changed).containsExactly(firstNote, thirdNote);
				assertThat(firstNote.getResolvedAt()).isNull();
				assertThat(thirdNote.getResolvedAt()).isNull();
				assertThat(firstNote.getResolvedBy()).isNull();
				assertThat(thirdNote.getResolvedBy()).isNull();
				assertThat(subject.isResolved()).isFalse();
				assertThat(subject.resolvedAt()).isNull();
				assertThat(subject.resolvedBy()).isNull();
			}

			@Test
			@DisplayName("Should clear the resolved note when only some are resolved")
			void shouldClearSomeResolutions() {
				firstNote.resolve(user);

				List<Note> changed = subject.unresolve();

				assertThat(changed).containsExactly(firstNote);
				assertThat(firstNote.isResolved()).isFalse();
				assertThat(subject.isResolved()).isFalse();
			}

			@Test
			@DisplayName("Should report no change when nothing was resolved")
			void shouldReportNoChange() {
				assertThat(subject.unresolve()).isEmpty();
				verify(firstNote).unresolve();
				verify(thirdNote).unresolve();
			}

		}

	}

	@Nested
	@DisplayName("isCollapsed")
	class CollapsedTest {

		@Test
		@DisplayName("Should be false for a non-diff discussion")
		void shouldBeFalseForNonDiffDiscussion() {
			Discussion plain = new Discussion(MERGE_REQUEST, List.of(plainNote(1)), false, false, authorizer);

			assertThat(plain.isCollapsed()).isFalse();
		}

		@Test
		@DisplayName("Should be true for a resolved resolvable diff discussion")
		void shouldBeTrueWhenResolved() {
			subject.resolve(User.of("alice"));

			assertThat(subject.isCollapsed()).isTrue();
		}

		@Test
		@DisplayName("Should be false for an unresolved resolvable diff discussion")
		void shouldBeFalseWhenUnresolved() {
			assertThat(subject.isCollapsed()).isFalse();
		}

		@Test
		@DisplayName("Should be false for an active unresolvable diff discussion")
		void shouldBeFalseWhenActive() {
			Discussion discussion = new Discussion(MERGE_REQUEST, List.of(plainNote(1)), true, true, authorizer);

			assertThat(discussion.isResolvable()).isFalse();
			assertThat(discussion.isCollapsed()).isFalse();
		}

		@Test
		@DisplayName("Should be true for an outdated unresolvable diff discussion")
		void shouldBeTrueWhenOutdated() {
			Discussion discussion = new Discussion(MERGE_REQUEST, List.of(plainNote(1)), true, false, authorizer);

			assertThat(discussion.isCollapsed()).isTrue();
		}

	}

	@Nested
	@DisplayName("Thread accessors")
	class ThreadAccessorsTest {

		@Test
		@DisplayName("Should expose id, first and last notes")
		void shouldExposeIdAndNotes() {
			assertThat(subject.id()).isEqualTo("discussion-1");
			assertThat(subject.firstNote()).isSameAs(firstNote);
			assertThat(subject.lastNote()).isSameAs(thirdNote);
			assertThat(subject.notes()).containsExactly(firstNote, secondNote, thirdNote);
			assertThat(subject.project()).isEqualTo(PROJECT);
		}

		@Test
		@DisplayName("Should report last update from the last note")
		void shouldReportLastUpdate() {
			assertThat(subject.lastUpdatedAt()).isEqualTo(thirdNote.getCreatedAt());
			assertThat(subject.lastUpdatedBy()).isEqualTo(thirdNote.getAuthor());
		}

		@Test
		@DisplayName("Should find the first note still to resolve")
		void shouldFindFirstNoteToResolve() {
			onlyFirstAndThirdResolvable();
			firstNote.resolve(User.of("alice"));

			assertThat(subject.firstNoteToResolve()).contains(thirdNote);

			thirdNote.resolve(User.of("alice"));
			assertThat(subject.firstNoteToResolve()).isEmpty();
		}

		@Test
		@DisplayName("Should not expose a mutable note list")
		void shouldNotExposeMutableNoteList() {
			assertThatThrownBy(() -> subject.notes().add(diffNote(9)))
				.isInstanceOf(UnsupportedOperationException.class);
		}

		@Test
		@DisplayName("Should reject an empty note list")
		void shouldRejectEmptyNoteList() {
			assertThatThrownBy(() -> new Discussion(MERGE_REQUEST, List.of(), true, true, authorizer))
				.isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Test
	@DisplayName("Resolving a mixed thread resolves only diff notes and reports the resolver")
	void shouldResolveMixedThreadEndToEnd() {
		Note note1 = spy(diffNote(11));
		Note note2 = spy(plainNote(12));
		Note note3 = spy(diffNote(13));
		Discussion discussion = diffDiscussion(List.of(note1, note2, note3));
		User userX = User.of("user-x");

		discussion.resolve(userX);

		assertThat(note1.isResolved()).isTrue();
		assertThat(note1.getResolvedBy()).isEqualTo(userX);
		verify(note2, never()).resolve(any());
		assertThat(note2.isResolved()).isFalse();
		assertThat(note3.isResolved()).isTrue();
		assertThat(discussion.isResolved()).isTrue();
		assertThat(discussion.resolvedBy()).isEqualTo(userX);
	}

}
